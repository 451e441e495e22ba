package xyz.vvrf.gds.util;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 有向图工具：邻接表、环检测与可达性。
 * 图以 {@code 节点 -> 后继列表} 的邻接表表示，节点是名称字符串。
 *
 * @author ruifeng.wen
 */
@Slf4j
public final class GraphUtils {

    private GraphUtils() {}

    /**
     * 由边集合构建邻接表 (源 -> 目标列表)。
     * nodes 中的每个节点都有条目；只有两端都在 nodes 中的边才会加入，后继按边的顺序排列。
     *
     * @param nodes 图中所有节点
     * @param edges 边列表，每条边是 [source, target]
     */
    public static Map<String, List<String>> buildAdjacencyList(Collection<String> nodes, List<String[]> edges) {
        Map<String, List<String>> adj = new LinkedHashMap<>();
        for (String node : nodes) {
            adj.put(node, new ArrayList<>());
        }
        for (String[] edge : edges) {
            if (adj.containsKey(edge[0]) && adj.containsKey(edge[1])) {
                adj.get(edge[0]).add(edge[1]);
            }
        }
        return adj;
    }

    /**
     * 使用三色深度优先搜索 (DFS) 检测环。
     * 按 adj 的键顺序作为 DFS 起点，遇到第一条回边即停止。
     *
     * @param adj 邻接表
     * @return 环上的节点 (按路径顺序，首节点不重复)；无环时为空
     */
    public static Optional<List<String>> findCycle(Map<String, List<String>> adj) {
        Map<String, Color> color = new HashMap<>();
        for (String node : adj.keySet()) {
            color.put(node, Color.WHITE);
        }
        List<String> path = new ArrayList<>();
        for (String node : adj.keySet()) {
            if (color.get(node) == Color.WHITE) {
                List<String> cycle = dfs(node, adj, color, path);
                if (cycle != null) {
                    log.debug("检测到环: {}", cycle);
                    return Optional.of(cycle);
                }
            }
        }
        return Optional.empty();
    }

    private enum Color { WHITE, GRAY, BLACK }

    // 显式栈的 DFS：path 是当前搜索路径 (GRAY 节点)，与 stack 中的帧一一对应
    private static List<String> dfs(String root, Map<String, List<String>> adj,
                                    Map<String, Color> color, List<String> path) {
        Deque<Frame> stack = new ArrayDeque<>();
        color.put(root, Color.GRAY);
        path.add(root);
        stack.push(new Frame(root, adj));
        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (!frame.successors.hasNext()) {
                stack.pop();
                path.remove(path.size() - 1); // 回溯
                color.put(frame.node, Color.BLACK);
                continue;
            }
            String neighbor = frame.successors.next();
            Color c = color.getOrDefault(neighbor, Color.BLACK);
            if (c == Color.GRAY) {
                // 回边 node -> neighbor：环是 path 中从 neighbor 开始的后缀
                return new ArrayList<>(path.subList(path.indexOf(neighbor), path.size()));
            }
            if (c == Color.WHITE) {
                color.put(neighbor, Color.GRAY);
                path.add(neighbor);
                stack.push(new Frame(neighbor, adj));
            }
        }
        return null;
    }

    private static final class Frame {
        private final String node;
        private final Iterator<String> successors;

        Frame(String node, Map<String, List<String>> adj) {
            this.node = node;
            this.successors = adj.getOrDefault(node, Collections.<String>emptyList()).iterator();
        }
    }

    /**
     * 广度优先搜索，返回从 start 出发可达的所有节点 (包含 start 本身)。
     */
    public static Set<String> reachableFrom(Map<String, ? extends Collection<String>> adj, String start) {
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(start);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (!visited.add(current)) {
                continue;
            }
            Collection<String> next = adj.get(current);
            if (next != null) {
                queue.addAll(next);
            }
        }
        return visited;
    }

    /**
     * from 是否能沿有向边到达 to。from 等于 to 时视为可达 (零步路径)。
     */
    public static boolean isReachable(Map<String, ? extends Collection<String>> adj, String from, String to) {
        return reachableFrom(adj, from).contains(to);
    }
}
