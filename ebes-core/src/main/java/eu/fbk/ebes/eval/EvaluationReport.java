package eu.fbk.ebes.eval;

import java.util.Locale;

import javax.annotation.Nullable;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * Precision, R-precision and average precision of a ranking.
 */
public final class EvaluationReport {

    private final double precision;

    private final double rPrecision;

    private final double averagePrecision;

    public EvaluationReport(final double precision, final double rPrecision,
            final double averagePrecision) {
        Preconditions.checkArgument(precision >= 0.0 && precision <= 1.0);
        Preconditions.checkArgument(rPrecision >= 0.0 && rPrecision <= 1.0);
        Preconditions.checkArgument(averagePrecision >= 0.0 && averagePrecision <= 1.0);
        this.precision = precision;
        this.rPrecision = rPrecision;
        this.averagePrecision = averagePrecision;
    }

    /**
     * Returns a report whose metrics are the arithmetic means of the metrics of the reports
     * specified.
     *
     * @param reports
     *            the reports to average, at least one
     * @return the mean report
     */
    public static EvaluationReport mean(final Iterable<EvaluationReport> reports) {
        double precision = 0.0;
        double rPrecision = 0.0;
        double averagePrecision = 0.0;
        int count = 0;
        for (final EvaluationReport report : reports) {
            precision += report.precision;
            rPrecision += report.rPrecision;
            averagePrecision += report.averagePrecision;
            ++count;
        }
        Preconditions.checkArgument(count > 0, "No reports to average");
        return new EvaluationReport(clamp(precision / count), clamp(rPrecision / count),
                clamp(averagePrecision / count));
    }

    private static double clamp(final double value) {
        return Math.min(1.0, Math.max(0.0, value));
    }

    public double getPrecision() {
        return this.precision;
    }

    public double getRPrecision() {
        return this.rPrecision;
    }

    public double getAveragePrecision() {
        return this.averagePrecision;
    }

    @Override
    public boolean equals(@Nullable final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof EvaluationReport)) {
            return false;
        }
        final EvaluationReport other = (EvaluationReport) object;
        return this.precision == other.precision && this.rPrecision == other.rPrecision
                && this.averagePrecision == other.averagePrecision;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(this.precision, this.rPrecision, this.averagePrecision);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "P=%.4f R-Prec=%.4f AP=%.4f", this.precision, this.rPrecision,
                this.averagePrecision);
    }

}
