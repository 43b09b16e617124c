/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.runtime.evaluation;

import com.chronicle.ruleengine.api.exceptions.ErrorCode;
import com.chronicle.ruleengine.api.exceptions.FormulaTooComplexException;
import com.chronicle.ruleengine.runtime.context.EvaluationContext;
import com.chronicle.ruleengine.runtime.operators.DomainOperatorResolver;
import com.chronicle.ruleengine.testkit.InMemoryEntityStore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static com.chronicle.ruleengine.testkit.Fixtures.json;
import static com.chronicle.ruleengine.testkit.Fixtures.object;
import static org.assertj.core.api.Assertions.assertThat;

class ExpressionEvaluatorTest {

    private ExpressionEvaluator evaluator;
    private EvaluationContext context;

    @BeforeEach
    void setUp() {
        evaluator = new ExpressionEvaluator(new DomainOperatorResolver(new InMemoryEntityStore()));
        ObjectNode data = object("{\"population\": 12000, \"name\": \"Riverbend\", \"gold\": null,"
                + " \"resources\": {\"food\": 40, \"tags\": [\"river\", \"trade\"]}}");
        context = EvaluationContext.of(data);
    }

    private JsonNode eval(String expression) {
        Evaluation result = evaluator.evaluate(json(expression), context);
        assertThat(result.isSuccess()).as("evaluation of %s failed: %s", expression, result.errorMessage()).isTrue();
        return result.value();
    }

    @Nested
    @DisplayName("Logical operators")
    class Logical {

        @Test
        @DisplayName("and returns the first falsy operand, or the last one")
        void andReturnsDecidingOperand() {
            assertThat(eval("{\"and\": [1, 0, 2]}").asInt()).isEqualTo(0);
            assertThat(eval("{\"and\": [1, \"x\"]}").asText()).isEqualTo("x");
        }

        @Test
        @DisplayName("or returns the first truthy operand")
        void orReturnsDecidingOperand() {
            assertThat(eval("{\"or\": [0, \"\", \"yes\", 3]}").asText()).isEqualTo("yes");
        }

        @Test
        @DisplayName("Short-circuited branches are not evaluated")
        void shortCircuitSkipsErrors() {
            // the second operand would fail (unknown operator) if it were evaluated
            assertThat(eval("{\"and\": [false, {\"bogus\": [1]}]}").asBoolean()).isFalse();
            assertThat(eval("{\"or\": [true, {\"bogus\": [1]}]}").asBoolean()).isTrue();
        }

        @Test
        @DisplayName("if chains else-if branches")
        void ifChains() {
            String expr = "{\"if\": [{\"<\": [{\"var\": \"population\"}, 1000]}, \"hamlet\","
                    + " {\"<\": [{\"var\": \"population\"}, 10000]}, \"town\", \"city\"]}";
            assertThat(eval(expr).asText()).isEqualTo("city");
        }

        @Test
        void negation() {
            assertThat(eval("{\"!\": [[]]}").asBoolean()).isTrue();
            assertThat(eval("{\"!!\": [\"0\"]}").asBoolean()).isTrue();
        }
    }

    @Nested
    @DisplayName("Comparison")
    class Comparison {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource(delimiter = '|', value = {
                "{\">\": [{\"var\": \"population\"}, 10000]}           | true",
                "{\"<\": [1, {\"var\": \"population\"}, 20000]}        | true",
                "{\"<=\": [1, 1, 0]}                                   | false",
                "{\"==\": [1, \"1\"]}                                  | true",
                "{\"===\": [1, \"1\"]}                                 | false",
                "{\"===\": [1, 1.0]}                                   | true",
                "{\"!=\": [{\"var\": \"name\"}, \"Riverbend\"]}        | false",
                "{\"<\": [{\"var\": \"missing\"}, -100]}               | true",
                "{\">\": [null, 0]}                                    | false"
        })
        void comparisons(String expression, boolean expected) {
            assertThat(eval(expression.trim()).asBoolean()).isEqualTo(expected);
        }

        @Test
        @DisplayName("Ordering objects is an evaluation error")
        void orderingObjectsFails() {
            Evaluation result = evaluator.evaluate(json("{\"<\": [{\"var\": \"resources\"}, 1]}"), context);

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.error().getErrorCode()).isEqualTo(ErrorCode.EVALUATION_ERROR);
        }
    }

    @Nested
    @DisplayName("Arithmetic")
    class Arithmetic {

        @Test
        void basicArithmetic() {
            assertThat(eval("{\"+\": [1, 2, 3]}").asInt()).isEqualTo(6);
            assertThat(eval("{\"-\": [10, 4]}").asInt()).isEqualTo(6);
            assertThat(eval("{\"-\": [5]}").asInt()).isEqualTo(-5);
            assertThat(eval("{\"*\": [{\"var\": \"resources.food\"}, 2]}").asInt()).isEqualTo(80);
            assertThat(eval("{\"/\": [7, 2]}").asDouble()).isEqualTo(3.5);
            assertThat(eval("{\"%\": [7, 2]}").asInt()).isEqualTo(1);
            assertThat(eval("{\"max\": [3, 9, 1]}").asInt()).isEqualTo(9);
            assertThat(eval("{\"min\": [3, 9, 1]}").asInt()).isEqualTo(1);
        }

        @Test
        @DisplayName("Integral results are integer nodes")
        void integralResultsAreInts() {
            assertThat(eval("{\"/\": [10, 2]}").isInt()).isTrue();
        }

        @Test
        @DisplayName("Null operands and division by zero yield null")
        void nullPropagation() {
            assertThat(eval("{\"+\": [{\"var\": \"gold\"}, 1]}").isNull()).isTrue();
            assertThat(eval("{\"*\": [{\"var\": \"nowhere\"}, 2]}").isNull()).isTrue();
            assertThat(eval("{\"/\": [1, 0]}").isNull()).isTrue();
            assertThat(eval("{\"%\": [1, 0]}").isNull()).isTrue();
        }

        @Test
        @DisplayName("Non-numeric strings are rejected")
        void nonNumericStringFails() {
            Evaluation result = evaluator.evaluate(json("{\"+\": [{\"var\": \"name\"}, 1]}"), context);

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.errorMessage()).contains("non-numeric");
        }
    }

    @Nested
    @DisplayName("Collections and strings")
    class Collections {

        @Test
        void membership() {
            assertThat(eval("{\"in\": [\"trade\", {\"var\": \"resources.tags\"}]}").asBoolean()).isTrue();
            assertThat(eval("{\"in\": [\"bend\", {\"var\": \"name\"}]}").asBoolean()).isTrue();
            assertThat(eval("{\"in\": [\"x\", {\"var\": \"nowhere\"}]}").asBoolean()).isFalse();
        }

        @Test
        void concatenation() {
            assertThat(eval("{\"cat\": [\"pop:\", {\"var\": \"population\"}]}").asText()).isEqualTo("pop:12000");
        }

        @Test
        void merge() {
            JsonNode merged = eval("{\"merge\": [[1, 2], 3, [{\"var\": \"population\"}]]}");

            assertThat(merged.size()).isEqualTo(4);
            assertThat(merged.get(3).asInt()).isEqualTo(12000);
        }

        @Test
        @DisplayName("Array with expressions evaluates every element")
        void arrayOfExpressions() {
            JsonNode array = eval("{\"in\": [12000, [1, {\"var\": \"population\"}]]}");
            assertThat(array.asBoolean()).isTrue();
        }
    }

    @Nested
    @DisplayName("Variables")
    class Variables {

        @Test
        void dottedPathsAndDefaults() {
            assertThat(eval("{\"var\": \"resources.tags.1\"}").asText()).isEqualTo("trade");
            assertThat(eval("{\"var\": [\"resources.wood\", 7]}").asInt()).isEqualTo(7);
            assertThat(eval("{\"var\": \"nope\"}").isNull()).isTrue();
        }

        @Test
        @DisplayName("Flat keys containing dots take precedence over traversal")
        void flatDottedKey() {
            EvaluationContext ctx = context.with("settlement.population", json("5"));

            assertThat(evaluator.evaluate(json("{\"var\": \"settlement.population\"}"), ctx).value().asInt())
                    .isEqualTo(5);
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("Unknown operator is reported, not thrown")
        void unknownOperator() {
            Evaluation result = evaluator.evaluate(json("{\"frobnicate\": [1]}"), context);

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.errorMessage()).contains("frobnicate");
        }

        @Test
        @DisplayName("Multi-key objects are reported as malformed")
        void multiKeyObject() {
            Evaluation result = evaluator.evaluate(json("{\"+\": [1], \"-\": [2]}"), context);

            assertThat(result.isSuccess()).isFalse();
        }

        @Test
        @DisplayName("Depth 10 evaluates, depth 11 is too complex")
        void depthLimit() {
            assertThat(evaluator.evaluate(json(nested(9)), context).isSuccess()).isTrue();

            Evaluation tooDeep = evaluator.evaluate(json(nested(10)), context);
            assertThat(tooDeep.isSuccess()).isFalse();
            assertThat(tooDeep.error()).isInstanceOf(FormulaTooComplexException.class);
            assertThat(((FormulaTooComplexException) tooDeep.error()).getDepth()).isEqualTo(11);
        }

        @Test
        @DisplayName("Null expression evaluates to null")
        void nullExpression() {
            assertThat(evaluator.evaluate((JsonNode) null, context).value().isNull()).isTrue();
        }

        /** {@code levels} nested "!" operators around a var: depth levels + 1. */
        private String nested(int levels) {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < levels; i++) {
                sb.append("{\"!\": [");
            }
            sb.append("{\"var\": \"population\"}");
            for (int i = 0; i < levels; i++) {
                sb.append("]}");
            }
            return sb.toString();
        }
    }
}
