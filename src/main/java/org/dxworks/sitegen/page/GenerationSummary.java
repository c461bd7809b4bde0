package org.dxworks.sitegen.page;

public record GenerationSummary(int pagesGenerated, int pagesFailed) {

    public boolean hasFailures() {
        return pagesFailed > 0;
    }
}
