package com.tsforecast.engine;

import com.tsforecast.pipeline.SeriesPoint;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Additive decomposition {@code y(t) = trend(t) + yearly(t) + weekly(t) + noise}: a linear trend
 * plus Fourier series for the seasonal components, fitted as ridge-penalised least squares on a
 * scaled target. The penalty only applies to the seasonal coefficients, which keeps the system
 * well-posed when a component is degenerate on the data (for example weekly terms on
 * Monday-only buckets).
 */
@Slf4j
@Component
public class AdditiveSeasonalEngine implements ForecastEngine {

    static final String NAME = "Additive Seasonal Regression";

    private static final double YEAR_DAYS = 365.25;
    private static final double WEEK_DAYS = 7.0;
    private static final int YEARLY_ORDER = 10;
    private static final int WEEKLY_ORDER = 3;
    private static final double SEASONAL_PENALTY = 1.0;
    private static final double TREND_PENALTY = 1e-6;
    private static final double INTERVAL_WIDTH = 0.80;

    private final double zScore = new NormalDistribution(0.0, 1.0)
        .inverseCumulativeProbability(0.5 + INTERVAL_WIDTH / 2.0);

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public FittedModel fit(List<SeriesPoint> history, SeasonalityOptions seasonality) {
        if (history.isEmpty()) {
            throw new IllegalArgumentException("Cannot fit a model on an empty series");
        }
        if (seasonality.daily()) {
            throw new IllegalArgumentException("Daily seasonality needs sub-daily timestamps");
        }
        Design design = new Design(history.get(0).ds(), history.get(history.size() - 1).ds(), seasonality);

        double scale = history.stream().mapToDouble(p -> Math.abs(p.y())).max().orElse(0.0);
        if (scale == 0.0) {
            scale = 1.0;
        }

        int n = history.size();
        int k = design.width();
        double[][] rows = new double[n][];
        double[] target = new double[n];
        for (int i = 0; i < n; i++) {
            rows[i] = design.row(history.get(i).ds());
            target[i] = history.get(i).y() / scale;
        }

        RealMatrix x = new Array2DRowRealMatrix(rows, false);
        RealMatrix gram = x.transpose().multiply(x);
        for (int j = 1; j < k; j++) {
            gram.addToEntry(j, j, j == 1 ? TREND_PENALTY : SEASONAL_PENALTY);
        }
        RealVector coefficients = new QRDecomposition(gram).getSolver()
            .solve(x.transpose().operate(new ArrayRealVector(target, false)));

        RealVector residuals = x.operate(coefficients).subtract(new ArrayRealVector(target, false));
        double sigma = Math.sqrt(residuals.dotProduct(residuals) / Math.max(1, n - 2)) * scale;

        log.debug("Fitted additive model | points={} | columns={} | sigma={}", n, k, sigma);
        return new Model(design, coefficients, scale, sigma, zScore, n);
    }

    /** Feature layout shared by fitting and prediction. */
    private static final class Design {
        private final LocalDate origin;
        private final LocalDate end;
        private final double spanDays;
        private final SeasonalityOptions seasonality;

        private Design(LocalDate origin, LocalDate end, SeasonalityOptions seasonality) {
            this.origin = origin;
            this.end = end;
            this.spanDays = Math.max(1.0, ChronoUnit.DAYS.between(origin, end));
            this.seasonality = seasonality;
        }

        int width() {
            return 2 + (seasonality.yearly() ? 2 * YEARLY_ORDER : 0) + (seasonality.weekly() ? 2 * WEEKLY_ORDER : 0);
        }

        double[] row(LocalDate date) {
            double[] row = new double[width()];
            double days = ChronoUnit.DAYS.between(origin, date);
            row[0] = 1.0;
            row[1] = days / spanDays;
            int col = 2;
            if (seasonality.yearly()) {
                col = fourier(row, col, date.toEpochDay() / YEAR_DAYS, YEARLY_ORDER);
            }
            if (seasonality.weekly()) {
                fourier(row, col, date.toEpochDay() / WEEK_DAYS, WEEKLY_ORDER);
            }
            return row;
        }

        private static int fourier(double[] row, int col, double cycles, int order) {
            for (int k = 1; k <= order; k++) {
                double angle = 2.0 * Math.PI * k * cycles;
                row[col++] = Math.sin(angle);
                row[col++] = Math.cos(angle);
            }
            return col;
        }

        /** Days past the end of the training window, as a fraction of its span. */
        double extrapolation(LocalDate date) {
            return Math.max(0.0, ChronoUnit.DAYS.between(end, date)) / spanDays;
        }
    }

    private static final class Model implements FittedModel {
        private final Design design;
        private final RealVector coefficients;
        private final double scale;
        private final double sigma;
        private final double zScore;
        private final int trainingPoints;

        private Model(Design design, RealVector coefficients, double scale, double sigma,
                      double zScore, int trainingPoints) {
            this.design = design;
            this.coefficients = coefficients;
            this.scale = scale;
            this.sigma = sigma;
            this.zScore = zScore;
            this.trainingPoints = trainingPoints;
        }

        @Override
        public List<ForecastPoint> predict(List<LocalDate> dates) {
            List<ForecastPoint> out = new ArrayList<>(dates.size());
            for (LocalDate date : dates) {
                double yhat = new ArrayRealVector(design.row(date), false).dotProduct(coefficients) * scale;
                double halfWidth = zScore * sigma
                    * Math.sqrt(1.0 + 1.0 / trainingPoints + design.extrapolation(date));
                out.add(new ForecastPoint(date, yhat, yhat - halfWidth, yhat + halfWidth));
            }
            return out;
        }
    }
}
