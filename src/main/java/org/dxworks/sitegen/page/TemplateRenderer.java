package org.dxworks.sitegen.page;

/**
 * Fills a page template and points root-relative links at the site's base path.
 */
public final class TemplateRenderer {

    public static final String TITLE_PLACEHOLDER = "{{ Title }}";
    public static final String CONTENT_PLACEHOLDER = "{{ Content }}";

    private TemplateRenderer() {}

    public static String render(String template, String title, String content, String basePath) {
        String html = template
                .replace(TITLE_PLACEHOLDER, title)
                .replace(CONTENT_PLACEHOLDER, content);
        return rewriteBasePath(html, basePath);
    }

    public static String rewriteBasePath(String html, String basePath) {
        return html
                .replace("href=\"/", "href=\"" + basePath)
                .replace("src=\"/", "src=\"" + basePath);
    }
}
