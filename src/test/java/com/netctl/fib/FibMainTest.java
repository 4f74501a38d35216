package com.netctl.fib;

import com.netctl.fib.agent.HttpFibAgentClient;
import com.netctl.fib.agent.MockFibAgent;
import com.netctl.fib.io.FibConfig;
import com.netctl.fib.io.FibConfigException;
import org.junit.Test;

import static org.junit.Assert.*;

public class FibMainTest {

    @Test
    public void testDryrunUsesInMemoryAgent() {
        FibConfig config = new FibConfig();
        config.setDryrun(true);
        assertTrue(FibMain.createAgent(config) instanceof MockFibAgent);
    }

    @Test
    public void testLiveProgrammingUsesHttpAgent() {
        FibConfig config = new FibConfig();
        config.setAgentEndpoint("http://localhost:5909");
        assertTrue(FibMain.createAgent(config) instanceof HttpFibAgentClient);
    }

    @Test
    public void testLiveProgrammingWithoutEndpointIsRejected() {
        FibConfig config = new FibConfig();
        config.setAgentEndpoint("  ");
        try {
            FibMain.createAgent(config);
            fail("expected FibConfigException");
        } catch (FibConfigException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("agentEndpoint"));
        }
    }
}
