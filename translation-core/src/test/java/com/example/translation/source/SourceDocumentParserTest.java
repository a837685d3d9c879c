package com.example.translation.source;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SourceDocumentParserTest {

    private final SourceDocumentParser parser = new SourceDocumentParser();

    @Test
    void testParse_BlankInputIsEmptyDocument() {
        assertThat(parser.parse("", "blank").children()).isEmpty();
        assertThat(parser.parse("  \n\t", "whitespace").children()).isEmpty();
        assertThat(parser.parse(null, "null").children()).isEmpty();
    }

    @Test
    void testParse_MalformedInputIsEmptyDocument() {
        assertThat(parser.parse("{\"a\": ", "broken").children()).isEmpty();
    }

    @Test
    void testParse_NonObjectTopLevelIsEmptyDocument() {
        assertThat(parser.parse("[\"a\", \"b\"]", "array").children()).isEmpty();
        assertThat(parser.parse("\"text\"", "string").children()).isEmpty();
    }

    @Test
    void testParse_TagsLeafTypes() {
        SourceNode.Branch root = parser.parse(
                "{\"s\":\"text\",\"o\":{},\"n\":3,\"b\":false,\"z\":null,\"a\":[]}", "types");

        assertThat(root.children().get("s")).isEqualTo(new SourceNode.Text("text"));
        assertThat(root.children().get("o")).isEqualTo(SourceNode.Branch.empty());
        assertThat(root.children().get("n")).isEqualTo(new SourceNode.Other("number"));
        assertThat(root.children().get("b")).isEqualTo(new SourceNode.Other("boolean"));
        assertThat(root.children().get("z")).isEqualTo(new SourceNode.Other("null"));
        assertThat(root.children().get("a")).isEqualTo(new SourceNode.Other("array"));
    }
}
