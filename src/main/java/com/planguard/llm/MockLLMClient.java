package com.planguard.llm;

import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

@Component
@Profile("mock")
public class MockLLMClient implements LLMClient {

    @Override
    public String generateWithRole(LlmRole role, String userPrompt, double temperature) {
        // Stub: the same valid two-step blocksworld plan for every prompt
        return """
                {
                  "goal_description": "Put block a on block b",
                  "nodes": [
                    {"id": "s1", "action_type": "pick-up", "params": {"block": "a"}, "description": "Pick up a"},
                    {"id": "s2", "action_type": "stack", "params": {"block": "a", "target": "b"}, "description": "Stack a on b"}
                  ],
                  "edges": [
                    {"source": "s1", "target": "s2", "relationship": "depends_on"}
                  ]
                }
                """;
    }
}
