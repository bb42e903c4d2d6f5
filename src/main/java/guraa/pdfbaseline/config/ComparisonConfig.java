package guraa.pdfbaseline.config;

import guraa.pdfbaseline.approval.ApprovalWorkflow;
import guraa.pdfbaseline.service.ComparisonEngine;
import guraa.pdfbaseline.visual.ChannelMode;
import guraa.pdfbaseline.visual.DiffOverlayBuilder;
import guraa.pdfbaseline.visual.SSIMCalculator;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Locale;
import java.util.concurrent.ExecutorService;

/**
 * Configuration for the comparison beans
 */
@Configuration
public class ComparisonConfig {

    @Bean
    public SSIMCalculator ssimCalculator(AppProperties properties) {
        AppProperties.Comparison comparison = properties.getComparison();
        return new SSIMCalculator(comparison.getWindowSize(), parseChannelMode(comparison.getChannelMode()));
    }

    @Bean
    public DiffOverlayBuilder diffOverlayBuilder(AppProperties properties) {
        return new DiffOverlayBuilder(properties.getOverlay().getAlpha());
    }

    @Bean
    public ComparisonEngine comparisonEngine(SSIMCalculator ssimCalculator,
                                             DiffOverlayBuilder diffOverlayBuilder,
                                             AppProperties properties,
                                             @Qualifier("comparisonExecutor") ExecutorService comparisonExecutor) {
        return new ComparisonEngine(ssimCalculator, diffOverlayBuilder,
                DiffOverlayBuilder.parseColor(properties.getOverlay().getHighlightColor()), comparisonExecutor);
    }

    @Bean
    public ApprovalWorkflow approvalWorkflow(ComparisonEngine comparisonEngine) {
        return new ApprovalWorkflow(comparisonEngine);
    }

    static ChannelMode parseChannelMode(String value) {
        try {
            return ChannelMode.valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new ConfigException("Unknown app.comparison.channel-mode: " + value, e);
        }
    }
}
