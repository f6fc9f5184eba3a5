package io.luascript.core.lower;

import static org.assertj.core.api.Assertions.assertThat;

import io.luascript.core.ir.IrBuilder;
import io.luascript.core.normalize.AstType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("StatementDispatch")
class StatementDispatchTest {

    private final IrLowerer lowerer = new IrLowerer(new IrBuilder(), "test.js");
    private final StatementDispatch dispatch = StatementDispatch.create(
            lowerer, new LoopLowerer(lowerer), new SwitchLowerer(lowerer), new TryLowerer(lowerer),
            new ClassLowerer(lowerer));

    @Test
    @DisplayName("covers every canonical statement type")
    void exhaustive() {
        assertThat(dispatch.coveredTypes()).containsExactlyInAnyOrderElementsOf(AstType.statements());
    }

    @Test
    @DisplayName("declarations place themselves")
    void selfPlacing() {
        assertThat(dispatch.lookup(AstType.VARIABLE_DECLARATION).orElseThrow().placement())
                .isEqualTo(StatementDispatch.Placement.SELF);
        assertThat(dispatch.lookup(AstType.CLASS_DECLARATION).orElseThrow().pushToBody()).isFalse();
    }

    @Test
    @DisplayName("blocks are placed by the caller")
    void callerPlaced() {
        StatementDispatch.Entry block = dispatch.lookup(AstType.BLOCK_STATEMENT).orElseThrow();

        assertThat(block.placement()).isEqualTo(StatementDispatch.Placement.CALLER);
        assertThat(block.pushToBody()).isFalse();
    }

    @Test
    @DisplayName("expression-level types have no entry")
    void expressionsAbsent() {
        assertThat(dispatch.lookup(AstType.CALL_EXPRESSION)).isEmpty();
        assertThat(dispatch.lookup(AstType.EXPRESSION_STATEMENT).orElseThrow().pushToBody()).isTrue();
    }
}
