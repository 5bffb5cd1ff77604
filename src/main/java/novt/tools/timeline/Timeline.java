package novt.tools.timeline;

import novt.tools.siaf.Instrument;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Time-ascending visibility samples of a fixed target.
 */
public record Timeline(double ra, double dec, List<Instrument> instruments, List<VisibilitySample> samples) {

    public Timeline {
        instruments = List.copyOf(instruments);
        samples = List.copyOf(samples);
    }

    public int size() {
        return samples.size();
    }

    public List<Instant> times() {
        return samples.stream().map(VisibilitySample::time).toList();
    }

    public double[] v3Pa() {
        return samples.stream().mapToDouble(VisibilitySample::v3Pa).toArray();
    }

    public double[] minPa(Instrument instrument) {
        return samples.stream().mapToDouble(sample -> sample.minPa(instrument)).toArray();
    }

    public double[] maxPa(Instrument instrument) {
        return samples.stream().mapToDouble(sample -> sample.maxPa(instrument)).toArray();
    }

    /**
     * Column headers in table order: Time, V3PA, then the min and max PA of every instrument
     **/
    public List<String> columnNames() {
        List<String> names = new ArrayList<>(List.of("Time", "V3PA"));
        for (Instrument instrument : instruments) {
            names.add(instrument.columnKey() + "_min_PA");
            names.add(instrument.columnKey() + "_max_PA");
        }
        return names;
    }
}
