package com.sbomcheck.core.diagnostic;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DiagnosticTest {

    @Test
    void completeness_prefixesMarker() {
        Diagnostic diagnostic = Diagnostic.completeness(ElementType.PACKAGE, "SPDXRef-app", "text");

        assertThat(diagnostic.message()).isEqualTo("\n*** completeness exception ***\ntext");
        assertThat(diagnostic.isCompletenessFinding()).isTrue();
        assertThat(diagnostic.parentId()).isNull();
    }

    @Test
    void specification_keepsMessageVerbatim() {
        Diagnostic diagnostic = Diagnostic.specification(ElementType.FILE, "SPDXRef-f", "SPDXRef-DOCUMENT", "bad");

        assertThat(diagnostic.message()).isEqualTo("bad");
        assertThat(diagnostic.isCompletenessFinding()).isFalse();
    }

    @Test
    void singleLineMessage_stripsLineBreaks() {
        Diagnostic diagnostic = Diagnostic.specification(ElementType.DOCUMENT, null, null, "first\r\nsecond\nthird");

        assertThat(diagnostic.singleLineMessage()).isEqualTo("firstsecondthird");
    }

    @Test
    void constructor_nullElementType_throwsException() {
        assertThatThrownBy(() -> new Diagnostic(null, null, null, "message"))
            .isInstanceOf(NullPointerException.class);
    }
}
