package pass.cfg;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Directed graph over block names. At most one edge per ordered pair,
 * self edges allowed. Iteration follows insertion order so that pattern
 * matching is deterministic.
 */
public class ControlFlowGraph {
    private final Map<String, Set<String>> successors = new LinkedHashMap<>();
    private final Map<String, Set<String>> predecessors = new LinkedHashMap<>();

    public void addNode(String node) {
        successors.computeIfAbsent(node, k -> new LinkedHashSet<>());
        predecessors.computeIfAbsent(node, k -> new LinkedHashSet<>());
    }

    public boolean containsNode(String node) {
        return successors.containsKey(node);
    }

    /**
     * Removes the node together with all incident edges.
     */
    public void removeNode(String node) {
        Set<String> succs = successors.remove(node);
        Set<String> preds = predecessors.remove(node);
        if (succs == null) {
            return;
        }
        for (String s : succs) {
            Set<String> p = predecessors.get(s);
            if (p != null) p.remove(node);
        }
        for (String p : preds) {
            Set<String> s = successors.get(p);
            if (s != null) s.remove(node);
        }
    }

    public void addEdge(String from, String to) {
        addNode(from);
        addNode(to);
        successors.get(from).add(to);
        predecessors.get(to).add(from);
    }

    public void removeEdge(String from, String to) {
        Set<String> s = successors.get(from);
        if (s != null) s.remove(to);
        Set<String> p = predecessors.get(to);
        if (p != null) p.remove(from);
    }

    public boolean hasEdge(String from, String to) {
        Set<String> s = successors.get(from);
        return s != null && s.contains(to);
    }

    /**
     * Replaces every outgoing edge of {@code node} with edges to {@code targets}.
     */
    public void setSuccessors(String node, List<String> targets) {
        for (String old : new ArrayList<>(successors(node))) {
            removeEdge(node, old);
        }
        for (String t : targets) {
            addEdge(node, t);
        }
    }

    public List<String> successors(String node) {
        Set<String> s = successors.get(node);
        if (s == null) {
            throw new IllegalArgumentException("No such block in graph: " + node);
        }
        return new ArrayList<>(s);
    }

    public List<String> predecessors(String node) {
        Set<String> p = predecessors.get(node);
        if (p == null) {
            throw new IllegalArgumentException("No such block in graph: " + node);
        }
        return new ArrayList<>(p);
    }

    public int outDegree(String node) {
        return successors.get(node).size();
    }

    public int inDegree(String node) {
        return predecessors.get(node).size();
    }

    public List<String> nodes() {
        return new ArrayList<>(successors.keySet());
    }

    public int nodeCount() {
        return successors.size();
    }

    public int edgeCount() {
        int count = 0;
        for (Set<String> s : successors.values()) {
            count += s.size();
        }
        return count;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, Set<String>> e : successors.entrySet()) {
            sb.append(e.getKey()).append(" -> ").append(e.getValue()).append("\n");
        }
        return sb.toString();
    }
}
