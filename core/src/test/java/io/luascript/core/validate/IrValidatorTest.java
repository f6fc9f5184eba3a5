package io.luascript.core.validate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.luascript.core.ir.IrBuilder;
import io.luascript.core.ir.IrDocument;
import io.luascript.core.ir.ValidationResult;
import io.luascript.core.lower.IrLowerer;
import io.luascript.core.normalize.AstNormalizer;
import io.luascript.core.parse.SourceParser;
import java.util.Iterator;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("IrValidator")
class IrValidatorTest {

    private final IrValidator validator = new IrValidator();

    private static IrDocument lower(String source) {
        JsonNode raw = new SourceParser("test.js").parse(source);
        JsonNode canonical = new AstNormalizer("test.js").normalizeProgram(raw, source);
        return new IrLowerer(new IrBuilder(), "test.js").lowerProgram(canonical).build();
    }

    private static ObjectNode sample() {
        return lower("""
                function sum(xs) {
                  let total = 0;
                  for (const x of xs) { if (x < 0) continue; total += x; }
                  return total;
                }
                """).toJson();
    }

    @Nested
    @DisplayName("well-formed documents")
    class WellFormed {

        @Test
        @DisplayName("a lowered program validates")
        void lowered() {
            ValidationResult result = validator.validate(lower("""
                    class Point { constructor(x) { this.x = x; } norm() { return this.x; } }
                    try { risky(); } catch (e) { log(e); } finally { done(); }
                    switch (k) { case 1: a(); break; default: b(); }
                    const [first, , ...others] = list;
                    """));

            assertThat(result.errors()).isEmpty();
            assertThat(result.ok()).isTrue();
        }

        @Test
        @DisplayName("an empty document validates")
        void empty() {
            assertThat(validator.validate(new IrBuilder().build()).ok()).isTrue();
        }
    }

    @Nested
    @DisplayName("reference checks")
    class References {

        @Test
        @DisplayName("a dangling body reference is reported")
        void danglingBody() {
            ObjectNode ir = sample();
            ((ArrayNode) ir.path("module").path("body")).add("id_111111");

            ValidationResult result = validator.validate(ir);

            assertThat(result.ok()).isFalse();
            assertThat(result.errors()).anySatisfy(e -> assertThat(e).contains("dangling reference 'id_111111'"));
        }

        @Test
        @DisplayName("a dangling field reference is reported at its path")
        void danglingField() {
            ObjectNode ir = sample();
            String fnId = ir.path("module").path("body").get(0).asText();
            ((ObjectNode) ir.path("nodes").path(fnId)).put("body", "id_1111111");

            ValidationResult result = validator.validate(ir);

            assertThat(result.errors())
                    .anySatisfy(e -> assertThat(e).isEqualTo("nodes." + fnId + ".body: dangling reference 'id_1111111'"));
        }

        @Test
        @DisplayName("an unknown schema version is reported")
        void unknownVersion() {
            ObjectNode ir = sample();
            ir.put("schemaVersion", "7.0.0");

            assertThat(validator.validate(ir).errors()).contains("Unrecognized schemaVersion '7.0.0'");
        }

        @Test
        @DisplayName("a node stored under the wrong key is reported")
        void idMismatch() {
            ObjectNode ir = sample();
            String fnId = ir.path("module").path("body").get(0).asText();
            ((ObjectNode) ir.path("nodes").path(fnId)).put("id", "id_0");

            assertThat(validator.validate(ir).errors())
                    .anySatisfy(e -> assertThat(e).contains("does not match its key"));
        }

        @Test
        @DisplayName("negative timings are reported")
        void negativePerf() {
            ObjectNode ir = sample();
            ((ObjectNode) ir.path("module").path("metadata")).putObject("metaPerf").put("parseMs", -1);

            assertThat(validator.validate(ir).errors())
                    .contains("module.metadata.metaPerf.parseMs must be a non-negative number");
        }
    }

    @Nested
    @DisplayName("control-flow graphs")
    class Graphs {

        @Test
        @DisplayName("every function's graph is registered and mirrored")
        void mirrored() {
            ObjectNode ir = sample();

            assertThat(ir.path("controlFlowGraphs").size()).isPositive();
            assertThat(validator.validate(ir).ok()).isTrue();
        }

        @Test
        @DisplayName("a successor without its predecessor entry is reported")
        void brokenMirror() {
            ObjectNode ir = sample();
            ObjectNode graph = firstGraph(ir);
            String entry = graph.path("blocks").get(0).path("id").asText();
            ((ObjectNode) graph.path("predecessors")).putArray(entry);
            ObjectNode successors = (ObjectNode) graph.path("successors");
            successors.putArray(entry).add(entry);

            ValidationResult result = validator.validate(ir);

            assertThat(result.errors())
                    .anySatisfy(e -> assertThat(e).contains("edge " + entry + " -> " + entry + " has no matching predecessor"));
        }

        @Test
        @DisplayName("an edge to an unknown block is reported")
        void unknownTarget() {
            ObjectNode ir = sample();
            ObjectNode graph = firstGraph(ir);
            String entry = graph.path("blocks").get(0).path("id").asText();
            ((ArrayNode) graph.path("successors").path(entry)).add("bb_1111");

            assertThat(validator.validate(ir).errors())
                    .anySatisfy(e -> assertThat(e).contains("target 'bb_1111' is not a block"));
        }

        @Test
        @DisplayName("a function pointing at a missing graph is reported")
        void missingGraph() {
            ObjectNode ir = sample();
            ir.set("controlFlowGraphs", JsonNodeFactory.instance.objectNode());

            assertThat(validator.validate(ir).errors())
                    .anySatisfy(e -> assertThat(e).contains("unknown control-flow graph"));
        }

        private ObjectNode firstGraph(ObjectNode ir) {
            Iterator<Map.Entry<String, JsonNode>> graphs = ir.path("controlFlowGraphs").fields();
            return (ObjectNode) graphs.next().getValue();
        }
    }

    @Test
    @DisplayName("non-object input is a programmer error")
    void rejectsNonObject() {
        assertThatThrownBy(() -> validator.validate(JsonNodeFactory.instance.arrayNode()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("errors are reported in a stable order")
    void stableOrder() {
        ObjectNode ir = sample();
        ir.put("schemaVersion", "1.0.0");
        ((ArrayNode) ir.path("module").path("body")).add("id_111111").add(42);

        assertThat(validator.validate(ir).errors()).isEqualTo(validator.validate(ir.deepCopy()).errors());
    }
}
