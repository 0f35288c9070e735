package im.arun.compextract.extract;

import im.arun.compextract.model.UINode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Candidate instances grouped by structural hash, in discovery order.
 * The first instance of every group is its canonical node.
 */
public class CandidateGroups {

    private final Map<String, List<UINode>> groups;

    CandidateGroups(Map<String, List<UINode>> groups) {
        Map<String, List<UINode>> copy = new LinkedHashMap<>();
        groups.forEach((hash, instances) -> copy.put(hash, Collections.unmodifiableList(new ArrayList<>(instances))));
        this.groups = Collections.unmodifiableMap(copy);
    }

    public static CandidateGroups empty() {
        return new CandidateGroups(Map.of());
    }

    public Set<String> hashes() {
        return groups.keySet();
    }

    public List<UINode> instances(String hash) {
        return groups.getOrDefault(hash, List.of());
    }

    public UINode canonical(String hash) {
        List<UINode> instances = instances(hash);
        return instances.isEmpty() ? null : instances.get(0);
    }

    public List<UINode> canonicals() {
        List<UINode> result = new ArrayList<>();
        for (List<UINode> instances : groups.values()) {
            result.add(instances.get(0));
        }
        return result;
    }

    public int size() {
        return groups.size();
    }

    public boolean isEmpty() {
        return groups.isEmpty();
    }

    public int instanceCount() {
        return groups.values().stream().mapToInt(List::size).sum();
    }
}
