package guraa.pdfbaseline;

import com.fasterxml.jackson.databind.ObjectMapper;
import guraa.pdfbaseline.report.ReportGenerationService;
import guraa.pdfbaseline.service.ComparisonEngine;
import guraa.pdfbaseline.visual.DiffOverlayBuilder;
import guraa.pdfbaseline.visual.SSIMCalculator;
import org.thymeleaf.spring5.SpringTemplateEngine;
import org.thymeleaf.templatemode.TemplateMode;
import org.thymeleaf.templateresolver.ClassLoaderTemplateResolver;

import java.awt.Color;

/**
 * Collaborators wired by hand, for tests that run without a Spring context.
 */
public final class TestBeans {

    private TestBeans() {
    }

    /**
     * Engine that scores pages on the calling thread.
     */
    public static ComparisonEngine comparisonEngine() {
        return new ComparisonEngine(new SSIMCalculator(), new DiffOverlayBuilder(), Color.RED, Runnable::run);
    }

    public static SpringTemplateEngine templateEngine() {
        ClassLoaderTemplateResolver resolver = new ClassLoaderTemplateResolver();
        resolver.setPrefix("templates/");
        resolver.setSuffix(".html");
        resolver.setTemplateMode(TemplateMode.HTML);
        resolver.setCharacterEncoding("UTF-8");
        SpringTemplateEngine templateEngine = new SpringTemplateEngine();
        templateEngine.setTemplateResolver(resolver);
        return templateEngine;
    }

    public static ReportGenerationService reportGenerationService() {
        return new ReportGenerationService(new ObjectMapper(), templateEngine());
    }
}
