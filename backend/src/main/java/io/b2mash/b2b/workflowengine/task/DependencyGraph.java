package io.b2mash.b2b.workflowengine.task;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;

/**
 * In-memory adjacency view of "depends on" edges. Nodes are opaque UUIDs, so the same graph serves
 * project tasks and template tasks.
 */
public final class DependencyGraph {

  private final Map<UUID, Set<UUID>> dependsOn = new HashMap<>();

  private DependencyGraph() {}

  public static DependencyGraph empty() {
    return new DependencyGraph();
  }

  public static <E> DependencyGraph of(
      Collection<E> edges, Function<E, UUID> from, Function<E, UUID> to) {
    var graph = new DependencyGraph();
    for (E edge : edges) {
      graph.addEdge(from.apply(edge), to.apply(edge));
    }
    return graph;
  }

  public static DependencyGraph ofTaskDependencies(Collection<TaskDependency> edges) {
    return of(edges, TaskDependency::getTaskId, TaskDependency::getDependsOnTaskId);
  }

  public void addEdge(UUID taskId, UUID dependsOnId) {
    dependsOn.computeIfAbsent(taskId, k -> new HashSet<>()).add(dependsOnId);
  }

  /**
   * Whether adding {@code taskId -> dependsOnId} closes a cycle: true for a self edge or when
   * {@code taskId} is already reachable from {@code dependsOnId}.
   */
  public boolean wouldCreateCycle(UUID taskId, UUID dependsOnId) {
    return taskId.equals(dependsOnId) || hasPath(dependsOnId, taskId);
  }

  /** Iterative DFS following depends-on edges. */
  public boolean hasPath(UUID from, UUID to) {
    var visited = new HashSet<UUID>();
    var stack = new ArrayDeque<UUID>();
    stack.push(from);
    while (!stack.isEmpty()) {
      var current = stack.pop();
      if (current.equals(to)) {
        return true;
      }
      if (!visited.add(current)) {
        continue;
      }
      for (UUID next : dependsOn.getOrDefault(current, Set.of())) {
        if (!visited.contains(next)) {
          stack.push(next);
        }
      }
    }
    return false;
  }

  public Set<UUID> dependenciesOf(UUID taskId) {
    return Set.copyOf(dependsOn.getOrDefault(taskId, Set.of()));
  }
}
