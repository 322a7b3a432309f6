package pass.cfg;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import translate.SymbolTable;

/**
 * A small graph template over named roles ({@code A}, {@code B}, ...) plus
 * degree constraints, and the rewrite applied when it matches.
 *
 * <p>Every template edge must exist between the matched blocks. Extra edges
 * between them (a join jumping back to the head, say) are allowed, except
 * self edges, which must agree with the template. Everything else is
 * restricted through {@link #accepts}.
 */
public abstract class CFGPattern {
    private record Edge(String from, String to) {
    }

    private final String name;
    private final List<String> roles;
    private final Set<Edge> edges = new HashSet<>();

    /**
     * @param edges template edges written as {@code "A->B"}
     */
    protected CFGPattern(String name, List<String> roles, String... edges) {
        this.name = name;
        this.roles = List.copyOf(roles);
        for (String e : edges) {
            String[] parts = e.split("->");
            if (parts.length != 2 || !roles.contains(parts[0].trim()) || !roles.contains(parts[1].trim())) {
                throw new IllegalArgumentException("bad template edge " + e + " in " + name);
            }
            this.edges.add(new Edge(parts[0].trim(), parts[1].trim()));
        }
    }

    public String getName() {
        return name;
    }

    /**
     * Degree constraints on a complete candidate assignment.
     */
    protected abstract boolean accepts(ControlFlowGraph cfg, Map<String, String> match);

    /**
     * Rewrites the matched blocks in place.
     */
    public abstract void apply(SymbolTable symbols, Map<String, String> match);

    /**
     * @return the first match in graph order (role to block), or null
     */
    public Map<String, String> match(ControlFlowGraph cfg) {
        return extend(cfg, new LinkedHashMap<>());
    }

    private Map<String, String> extend(ControlFlowGraph cfg, Map<String, String> partial) {
        if (partial.size() == roles.size()) {
            return accepts(cfg, partial) ? new LinkedHashMap<>(partial) : null;
        }
        String role = roles.get(partial.size());
        for (String candidate : candidates(cfg, role, partial)) {
            if (partial.containsValue(candidate) || !consistent(cfg, role, candidate, partial)) {
                continue;
            }
            partial.put(role, candidate);
            Map<String, String> found = extend(cfg, partial);
            if (found != null) {
                return found;
            }
            partial.remove(role);
        }
        return null;
    }

    // 优先从已匹配的邻居出发, 避免枚举整张图
    private List<String> candidates(ControlFlowGraph cfg, String role, Map<String, String> partial) {
        for (Map.Entry<String, String> e : partial.entrySet()) {
            if (edges.contains(new Edge(e.getKey(), role))) {
                return cfg.successors(e.getValue());
            }
            if (edges.contains(new Edge(role, e.getKey()))) {
                return cfg.predecessors(e.getValue());
            }
        }
        return new ArrayList<>(cfg.nodes());
    }

    private boolean consistent(ControlFlowGraph cfg, String role, String node, Map<String, String> partial) {
        if (edges.contains(new Edge(role, role)) != cfg.hasEdge(node, node)) {
            return false;
        }
        for (Map.Entry<String, String> e : partial.entrySet()) {
            String other = e.getValue();
            if (edges.contains(new Edge(e.getKey(), role)) && !cfg.hasEdge(other, node)) {
                return false;
            }
            if (edges.contains(new Edge(role, e.getKey())) && !cfg.hasEdge(node, other)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return name;
    }
}
