package com.stockpulse.output;

import com.stockpulse.model.Report;
import com.stockpulse.model.ReportSection;
import com.stockpulse.model.ReportSummary;
import com.stockpulse.model.SentimentRecord;
import com.stockpulse.model.TechnicalPattern;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;
import org.thymeleaf.templatemode.TemplateMode;
import org.thymeleaf.templateresolver.ClassLoaderTemplateResolver;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders a {@link Report} as Markdown using the Thymeleaf TEXT template {@code templates/report.txt}.
 */
public final class MarkdownReportRenderer {
    private static final String TEMPLATE = "report";

    private final TemplateEngine templateEngine;

    public MarkdownReportRenderer() {
        ClassLoaderTemplateResolver resolver = new ClassLoaderTemplateResolver();
        resolver.setPrefix("templates/");
        resolver.setSuffix(".txt");
        resolver.setTemplateMode(TemplateMode.TEXT);
        resolver.setCharacterEncoding("UTF-8");
        resolver.setCacheable(false);

        this.templateEngine = new TemplateEngine();
        this.templateEngine.setTemplateResolver(resolver);
    }

    public String render(Report report) {
        Context context = new Context(Locale.ROOT);
        variables(report).forEach(context::setVariable);
        return templateEngine.process(TEMPLATE, context).trim() + "\n";
    }

    Map<String, Object> variables(Report report) {
        ReportSummary summary = report.summary();
        Map<String, Object> vars = new LinkedHashMap<>();
        vars.put("title", report.title());
        vars.put("ticker", report.ticker());
        vars.put("range", report.range().start() + " to " + report.range().end());
        vars.put("articleCount", summary.articleCount());
        vars.put("sentimentCount", summary.sentimentCount());
        vars.put("patternCount", summary.patternCount());
        vars.put("correlationCount", summary.correlationCount());
        vars.put("agreeingCount", summary.agreeingCount());
        vars.put("agreementRate", percent(summary.agreementRate()));
        vars.put("bullishNews", summary.bullishNews());
        vars.put("bearishNews", summary.bearishNews());
        vars.put("neutralNews", summary.neutralNews());
        vars.put("newsTone", summary.newsTone());
        vars.put("marketTone", summary.marketTone());
        vars.put("strongestLink", summary.strongestLink());

        List<Map<String, String>> sections = new ArrayList<>();
        for (ReportSection section : report.sections()) {
            Map<String, String> row = new LinkedHashMap<>();
            row.put("heading", section.heading());
            row.put("body", section.body());
            sections.add(row);
        }
        vars.put("sections", sections);

        List<String> patterns = new ArrayList<>();
        for (TechnicalPattern pattern : report.patterns()) {
            patterns.add(patternLine(pattern));
        }
        vars.put("patterns", patterns);

        List<String> lonelyNews = new ArrayList<>();
        for (SentimentRecord record : report.uncorrelatedSentiments()) {
            lonelyNews.add(sentimentLine(record));
        }
        vars.put("uncorrelatedSentiments", lonelyNews);

        List<String> lonelyPatterns = new ArrayList<>();
        for (TechnicalPattern pattern : report.uncorrelatedPatterns()) {
            lonelyPatterns.add(patternLine(pattern));
        }
        vars.put("uncorrelatedPatterns", lonelyPatterns);
        vars.put("warnings", report.warnings());
        return vars;
    }

    private static String patternLine(TechnicalPattern pattern) {
        StringBuilder sb = new StringBuilder();
        sb.append("**").append(pattern.label()).append("** (`").append(pattern.id()).append("`) ");
        if (pattern.startDate().equals(pattern.endDate())) {
            sb.append("on ").append(pattern.anchorDate());
        } else {
            sb.append("from ").append(pattern.startDate()).append(" to ").append(pattern.endDate())
                    .append(", anchored ").append(pattern.anchorDate());
        }
        sb.append(String.format(Locale.US, ", magnitude %.2f%%", pattern.magnitude() * 100.0));
        if (!pattern.note().isEmpty()) {
            sb.append(" (").append(pattern.note()).append(')');
        }
        return sb.toString();
    }

    private static String sentimentLine(SentimentRecord record) {
        StringBuilder sb = new StringBuilder();
        sb.append(record.eventDate()).append(" `").append(record.articleId()).append("`: ")
                .append(record.polarity().name().toLowerCase(Locale.ROOT))
                .append(String.format(Locale.US, " (impact %.2f, confidence %.2f)", record.magnitude(), record.confidence()));
        if (!record.eventTags().isEmpty()) {
            sb.append(", tags: ").append(String.join(", ", record.eventTags()));
        }
        return sb.toString();
    }

    private static String percent(double rate) {
        return String.format(Locale.US, "%.0f%%", rate * 100.0);
    }
}
