package com.planguard.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles({"test", "mock"})
class PlanControllerTest {

    @Autowired
    private MockMvc mockMvc;

    private void expectBadRequest(String json) throws Exception {
        mockMvc.perform(post("/plans/run").contentType(MediaType.APPLICATION_JSON).content(json))
                .andExpect(status().isBadRequest());
    }

    @Test
    void testRunWithInitialState() throws Exception {
        String json = """
                {
                  "goal": "Put block a on block b",
                  "domain": "blocksworld",
                  "initialState": {
                    "onTable": ["a", "b"],
                    "clear": ["a", "b"]
                  }
                }
                """;

        mockMvc.perform(post("/plans/run").contentType(MediaType.APPLICATION_JSON).content(json))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(true))
                .andExpect(jsonPath("$.actions[0]").value("(pick-up a)"))
                .andExpect(jsonPath("$.actions[1]").value("(stack a b)"))
                .andExpect(jsonPath("$.layers.structural").value("PASSED"))
                .andExpect(jsonPath("$.layers.symbolic").value("NOT_APPLICABLE"))
                .andExpect(jsonPath("$.layers.simulation").value("PASSED"))
                .andExpect(jsonPath("$.repairAttempts").value(0));
    }

    @Test
    void testSimulationFailureIsReported() throws Exception {
        // b is covered by c, so stacking onto it fails on every attempt
        String json = """
                {
                  "goal": "Put block a on block b",
                  "maxRepairAttempts": 1,
                  "initialState": {
                    "onTable": ["a", "b"],
                    "clear": ["a", "c"],
                    "on": [["c", "b"]]
                  }
                }
                """;

        mockMvc.perform(post("/plans/run").contentType(MediaType.APPLICATION_JSON).content(json))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(false))
                .andExpect(jsonPath("$.layers.simulation").value("FAILED"))
                .andExpect(jsonPath("$.repairAttempts").value(1))
                .andExpect(jsonPath("$.diagnostics[0]").value("[SIMULATION] Step 2: Cannot stack on b - not clear"));
    }

    @Test
    void testBlankGoalIsRejected() throws Exception {
        expectBadRequest("{\"goal\": \"   \"}");
    }

    @Test
    void testHalfPddlPairIsRejected() throws Exception {
        expectBadRequest("{\"goal\": \"g\", \"domainFile\": \"/tmp/domain.pddl\"}");
    }

    @Test
    void testUnknownDomainIsRejected() throws Exception {
        expectBadRequest("{\"goal\": \"g\", \"domain\": \"chess\"}");
    }

    @Test
    void testMalformedOnPairIsRejected() throws Exception {
        expectBadRequest("{\"goal\": \"g\", \"initialState\": {\"on\": [[\"a\", \"b\", \"c\"]]}}");
    }
}
