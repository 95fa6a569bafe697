package fr.lapetina.aigateway.domain.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Price of one model, in USD per million input and output tokens.
 */
public record ModelPricing(BigDecimal inputPerMillion, BigDecimal outputPerMillion) {

    public static final ModelPricing FREE = new ModelPricing(BigDecimal.ZERO, BigDecimal.ZERO);

    private static final BigDecimal MILLION = BigDecimal.valueOf(1_000_000L);
    private static final int COST_SCALE = 10;

    public ModelPricing {
        Objects.requireNonNull(inputPerMillion, "inputPerMillion is required");
        Objects.requireNonNull(outputPerMillion, "outputPerMillion is required");
        if (inputPerMillion.signum() < 0 || outputPerMillion.signum() < 0) {
            throw new IllegalArgumentException("Prices must be non-negative");
        }
    }

    public static ModelPricing perMillion(double input, double output) {
        return new ModelPricing(BigDecimal.valueOf(input), BigDecimal.valueOf(output));
    }

    /**
     * Cost in USD of the given token counts.
     */
    public BigDecimal cost(long inputTokens, long outputTokens) {
        BigDecimal total = inputPerMillion.multiply(BigDecimal.valueOf(inputTokens))
                .add(outputPerMillion.multiply(BigDecimal.valueOf(outputTokens)));
        return total.divide(MILLION, COST_SCALE, RoundingMode.HALF_UP);
    }

    public BigDecimal cost(TokenUsage usage) {
        return cost(usage.inputTokens(), usage.outputTokens());
    }
}
