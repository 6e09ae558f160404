package work.mcps.runtime;

@FunctionalInterface
public interface AgentFactory {
    Agent create(AgentDefinition definition);
}
