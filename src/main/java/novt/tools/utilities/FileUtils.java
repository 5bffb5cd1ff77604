package novt.tools.utilities;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class FileUtils {

    private FileUtils() {

    }

    /**
     * Opens a data file, looking first at the file system and then on the classpath
     *
     * @param location a file path or a classpath resource name
     * @return a UTF-8 reader; the caller closes it
     * @throws FileNotFoundException if the location can be found in neither place
     **/
    public static Reader openReader(String location) throws IOException {
        Path path = Paths.get(location);
        if (Files.isRegularFile(path)) {
            return Files.newBufferedReader(path, StandardCharsets.UTF_8);
        }
        String resource = location.startsWith("/") ? location.substring(1) : location;
        InputStream stream = FileUtils.class.getClassLoader().getResourceAsStream(resource);
        if (stream == null) {
            throw new FileNotFoundException("No file or classpath resource named " + location);
        }
        return new InputStreamReader(stream, StandardCharsets.UTF_8);
    }

}
