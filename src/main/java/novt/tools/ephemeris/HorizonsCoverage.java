package novt.tools.ephemeris;

import novt.tools.utilities.AppConfig;
import novt.tools.utilities.TimeUtils;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the last date of the observatory ephemeris published by JPL Horizons.
 * <p>
 * Asks for an ephemeris running to a date far in the future; Horizons answers with an error message that names the
 * last available date.
 **/
public class HorizonsCoverage {

    static final String FAR_FUTURE = "9999-01-01";
    private static final Pattern LAST_DATE = Pattern.compile("after A\\.D\\. (\\d{4}-[a-zA-Z]+-\\d{1,2})");

    private final String urlTemplate;
    private final LocalDate minimumDate;
    private final Duration timeout;
    private final HttpClient client;

    public HorizonsCoverage(AppConfig config) {
        this(config.horizonsUrl(), config.minimumDate(), Duration.ofSeconds(config.horizonsTimeoutSeconds()));
    }

    public HorizonsCoverage(String urlTemplate, LocalDate minimumDate, Duration timeout) {
        this.urlTemplate = urlTemplate;
        this.minimumDate = minimumDate;
        this.timeout = timeout;
        this.client = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    /**
     * Blocking query, bounded by the configured timeout
     *
     * @throws IOException if the request fails, times out or the answer names no date
     **/
    public LocalDate maximumDate() throws IOException {
        if (urlTemplate == null || urlTemplate.isBlank()) {
            throw new IOException("No Horizons URL configured");
        }
        HttpRequest request;
        try {
            String url = String.format(urlTemplate, TimeUtils.formatHorizonsDate(minimumDate), FAR_FUTURE);
            request = HttpRequest.newBuilder(URI.create(url)).timeout(timeout).GET().build();
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid Horizons URL template " + urlTemplate, e);
        }

        try {
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
            return parseMaximumDate(response.body());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while querying Horizons", e);
        }
    }

    static LocalDate parseMaximumDate(String body) throws IOException {
        Matcher matcher = LAST_DATE.matcher(body == null ? "" : body);
        if (!matcher.find()) {
            throw new IOException("Horizons response does not name a last available date");
        }
        try {
            return TimeUtils.parseHorizonsDate(matcher.group(1));
        } catch (DateTimeParseException e) {
            throw new IOException("Unreadable Horizons date " + matcher.group(1), e);
        }
    }

}
