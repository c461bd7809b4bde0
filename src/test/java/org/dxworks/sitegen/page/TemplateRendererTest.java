package org.dxworks.sitegen.page;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TemplateRendererTest {

    @Test
    void fillsPlaceholders() {
        String html = TemplateRenderer.render("<title>{{ Title }}</title><main>{{ Content }}</main>",
                "Home", "<div><p>hi</p></div>", "/");
        assertEquals("<title>Home</title><main><div><p>hi</p></div></main>", html);
    }

    @Test
    void rewritesRootRelativeLinksInTemplateAndContent() {
        String html = TemplateRenderer.render("<link href=\"/index.css\">{{ Content }}",
                "t", "<a href=\"/about\">a</a><img src=\"/cat.png\" alt=\"\">", "/site/");
        assertEquals("<link href=\"/site/index.css\"><a href=\"/site/about\">a</a><img src=\"/site/cat.png\" alt=\"\">", html);
    }

    @Test
    void leavesAbsoluteUrlsAlone() {
        assertEquals("<a href=\"https://example.com\">x</a>",
                TemplateRenderer.rewriteBasePath("<a href=\"https://example.com\">x</a>", "/site/"));
    }
}
