package io.cspbuilder.core.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import org.junit.jupiter.api.Test;

/** Tests for the fixed {@link ScriptAttribute} table. */
class ScriptAttributeTest {

    @Test
    void declarationOrderIsRenderingOrder() {
        assertThat(Arrays.stream(ScriptAttribute.values()).map(ScriptAttribute::attributeName))
                .containsExactly("nonce", "id", "src", "type", "async", "defer", "integrity", "nomodule");
    }

    @Test
    void eachAttributeHasItsRule() {
        assertThat(ScriptAttribute.ASYNC.rule()).isEqualTo(ScriptAttribute.Rule.TRI_STATE_ASYNC);
        assertThat(ScriptAttribute.DEFER.rule()).isEqualTo(ScriptAttribute.Rule.BARE_BOOLEAN);
        assertThat(ScriptAttribute.NOMODULE.rule()).isEqualTo(ScriptAttribute.Rule.BARE_BOOLEAN);
        assertThat(ScriptAttribute.INTEGRITY.rule()).isEqualTo(ScriptAttribute.Rule.DEFAULT_STRING);
        assertThat(ScriptAttribute.NONCE.rule()).isEqualTo(ScriptAttribute.Rule.DEFAULT_STRING);
    }
}
