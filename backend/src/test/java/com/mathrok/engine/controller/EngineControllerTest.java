package com.mathrok.engine.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class EngineControllerTest {

    @Autowired
    private MockMvc mockMvc;

    private ResultActions postJson(String path, String body) throws Exception {
        return mockMvc.perform(post(path).contentType(MediaType.APPLICATION_JSON).content(body));
    }

    @Test
    void health_reportsHealthy() throws Exception {
        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(content().string("Mathrok engine is healthy"));
    }

    @Test
    void parse_returnsTreeAndMetadata() throws Exception {
        postJson("/api/parse", "{\"expression\": \"2x + 3 = 7\"}")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.result.normalized").value("2x + 3 = 7"))
                .andExpect(jsonPath("$.result.variables[0]").value("x"))
                .andExpect(jsonPath("$.result.ast.type").value("equation"))
                .andExpect(jsonPath("$.result.ast.right.value").value(7.0))
                .andExpect(jsonPath("$.result.validation.valid").value(true))
                .andExpect(jsonPath("$.result.steps[0].operation").value("parsing"))
                .andExpect(jsonPath("$.error").doesNotExist());
    }

    @Test
    void parse_invalidExpressionIsBadRequestWithPosition() throws Exception {
        postJson("/api/parse", "{\"expression\": \"((x+1)\"}")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.type").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.error.message").value("Unmatched opening parenthesis"))
                .andExpect(jsonPath("$.error.start").value(0))
                .andExpect(jsonPath("$.error.end").value(1))
                .andExpect(jsonPath("$.error.suggestions[0]").value("Add missing closing parenthesis"));
    }

    @Test
    void parse_blankExpressionFailsRequestValidation() throws Exception {
        postJson("/api/parse", "{\"expression\": \"\"}")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.type").value("INVALID_REQUEST"))
                .andExpect(jsonPath("$.error.message")
                        .value("Validation error: expression - Expression cannot be blank; "));
    }

    @Test
    void parse_outOfRangeOverrideFailsRequestValidation() throws Exception {
        postJson("/api/parse", "{\"expression\": \"x\", \"config\": {\"precision\": 0}}")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.type").value("INVALID_REQUEST"));
    }

    @Test
    void validate_listsErrorsWithoutFailingTheRequest() throws Exception {
        postJson("/api/validate", "{\"expression\": \"2 * / 3\"}")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(false))
                .andExpect(jsonPath("$.errors", hasSize(1)))
                .andExpect(jsonPath("$.errors[0].severity").value("ERROR"))
                .andExpect(jsonPath("$.errors[0].message").value("Consecutive operators: * /"))
                .andExpect(jsonPath("$.errors[0].span.start").value(4));
    }

    @Test
    void validate_lexingFailureBecomesSingleError() throws Exception {
        postJson("/api/validate", "{\"expression\": \"2 $ 3\"}")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(false))
                .andExpect(jsonPath("$.errors", hasSize(1)))
                .andExpect(jsonPath("$.errors[0].message").value("Unexpected character '$' at position 2"))
                .andExpect(jsonPath("$.errors[0].span.start").value(2));
    }

    @Test
    void validate_validExpression() throws Exception {
        postJson("/api/validate", "{\"expression\": \"sin(x) + 1\"}")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(true))
                .andExpect(jsonPath("$.errors", hasSize(0)));
    }

    @Test
    void solve_quadraticEquation() throws Exception {
        postJson("/api/solve", "{\"expression\": \"x^2 - 4 = 0\"}")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.result.equationType").value("QUADRATIC"))
                .andExpect(jsonPath("$.result.solutions", hasSize(2)))
                .andExpect(jsonPath("$.result.solutions[0].value").value("2"))
                .andExpect(jsonPath("$.result.solutions[0].exact").value(true))
                .andExpect(jsonPath("$.result.steps[0].id").value("identify_type"));
    }

    @Test
    void solve_withBindingsAndWithoutSteps() throws Exception {
        postJson("/api/solve", "{\"expression\": \"a*t + 1 = 7\", \"variable\": \"t\", "
                + "\"bindings\": {\"a\": 3}, \"config\": {\"showSteps\": false}}")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result.solutions[0].variable").value("t"))
                .andExpect(jsonPath("$.result.solutions[0].value").value("2"))
                .andExpect(jsonPath("$.result.steps", hasSize(1)));
    }

    @Test
    void solve_inequalityIsAComputationError() throws Exception {
        postJson("/api/solve", "{\"expression\": \"2x < 4\"}")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.type").value("COMPUTATION_ERROR"));
    }

    @Test
    void solve_nullBindingValueFailsRequestValidation() throws Exception {
        postJson("/api/solve", "{\"expression\": \"a*x = 1\", \"bindings\": {\"a\": null}}")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.type").value("INVALID_REQUEST"))
                .andExpect(jsonPath("$.error.message", containsString("Binding values cannot be null")));
    }

    @Test
    void solve_variableMustBeAnIdentifier() throws Exception {
        postJson("/api/solve", "{\"expression\": \"x = 1\", \"variable\": \"1x\"}")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.type").value("INVALID_REQUEST"))
                .andExpect(jsonPath("$.error.message")
                        .value("Validation error: variable - Variable must be an identifier; "));
    }
}
