package org.dxworks.sitegen.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.approvaltests.Approvals;
import org.dxworks.sitegen.TestUtils;
import org.junit.jupiter.api.Test;

public class InlineTokenizerApprovalTest {

    @Test
    void tokenize_AllStyles() throws JsonProcessingException {
        verify("Here's the deal, **I like Tolkien**. See ![a hobbit](/img/hobbit.png) "
                + "or [the map](/map), it's _deep_ `lore`");
    }

    @Test
    void tokenize_Delimiters_at_edges() throws JsonProcessingException {
        verify("**bold**");
    }

    private static void verify(String text) throws JsonProcessingException {
        Approvals.verify(TestUtils.APPROVAL_MAPPER.writeValueAsString(InlineTokenizer.tokenize(text)) + "\n");
    }
}
