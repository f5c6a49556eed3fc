package com.stockpulse.data.text;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;

/**
 * Turns feed HTML snippets into plain article text based on Jsoup.
 */
public final class ArticleTextCleaner {

    public String toPlainText(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        Document doc = Jsoup.parse(html);
        doc.select("script,noscript,style,iframe,object,embed,img,figure").remove();
        cleanupMarkdownArtifacts(doc);
        return normalizeInline(doc.body() == null ? doc.text() : doc.body().text());
    }

    /**
     * Title and description joined into the text handed to extraction; identical halves are not repeated.
     */
    public String articleBody(String title, String descriptionHtml) {
        String heading = normalizeInline(title);
        String body = toPlainText(descriptionHtml);
        if (body.isEmpty()) {
            return heading;
        }
        if (heading.isEmpty() || body.startsWith(heading)) {
            return body;
        }
        return heading + ". " + body;
    }

    private void cleanupMarkdownArtifacts(Document doc) {
        for (Element el : doc.getAllElements()) {
            for (TextNode node : el.textNodes()) {
                String cleaned = stripMarkdown(node.text());
                if (!cleaned.equals(node.text())) {
                    node.text(cleaned);
                }
            }
        }
    }

    private String stripMarkdown(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String cleaned = text.replace("```", " ")
                .replace("###", " ")
                .replace("**", " ")
                .replace("__", " ");
        return normalizeInline(cleaned);
    }

    private String normalizeInline(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        return text.replace("\r", " ")
                .replace("\n", " ")
                .replace('\u00a0', ' ')
                .replaceAll("\\s+", " ")
                .trim();
    }
}
