package im.arun.compextract.extract;

import im.arun.compextract.config.ExtractorConfig;
import im.arun.compextract.config.KeywordTable;
import im.arun.compextract.hash.StructuralHasher;
import im.arun.compextract.model.ObjectType;
import im.arun.compextract.model.UINode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Bottom-up walk that decides which subtrees are significant enough to become
 * components and groups them by structural hash.
 *
 * Root nodes are never candidates: they have no parent to hold a reference.
 */
public class CandidateCollector {
    private static final Logger logger = LoggerFactory.getLogger(CandidateCollector.class);

    private final ExtractorConfig config;
    private final KeywordTable keywords;
    private final StructuralHasher hasher;
    private final NodeClassifier classifier;

    public CandidateCollector(ExtractorConfig config, StructuralHasher hasher, NodeClassifier classifier) {
        this.config = config;
        this.keywords = config.getKeywords();
        this.hasher = hasher;
        this.classifier = classifier;
    }

    public CandidateGroups collect(List<UINode> roots) {
        if (roots == null || roots.isEmpty()) {
            return CandidateGroups.empty();
        }

        Map<String, List<UINode>> groups = new LinkedHashMap<>();
        for (UINode root : roots) {
            collectChildren(root, groups);
        }

        logger.info("Collected {} candidate group(s) from {} root(s)", groups.size(), roots.size());
        return new CandidateGroups(groups);
    }

    private void collectChildren(UINode node, Map<String, List<UINode>> groups) {
        for (UINode child : node.getChildren()) {
            // Nested candidates are marked before their ancestor is evaluated
            if (child.hasChildren()) {
                collectChildren(child, groups);
            }

            if (isCandidate(child)) {
                accept(child, groups);
            }
        }
    }

    private void accept(UINode node, Map<String, List<UINode>> groups) {
        String hash = hasher.hash(node);
        node.setStructuralHash(hash);
        node.setExtracted(true);

        List<UINode> instances = groups.computeIfAbsent(hash, h -> new ArrayList<>());
        if (!instances.isEmpty()) {
            logger.debug("Duplicate structure: '{}' reuses '{}'", node.getName(), instances.get(0).getName());
        }
        instances.add(node);
    }

    boolean isCandidate(UINode node) {
        if (!node.hasChildren()) {
            return false;
        }

        ObjectType type = node.getType();
        boolean extension = type.isExtension();
        if (type != ObjectType.COMPONENT && !extension) {
            return false;
        }

        // Hidden layers only matter when they carry an alternate interaction state
        if (!node.isShown() && !keywords.isAlternateState(node.getName())) {
            return false;
        }

        if (isDenied(node.getName())) {
            return false;
        }

        if (!extension) {
            if (classifier.isPureShapeGroup(node)) {
                return false;
            }
            if (classifier.hasMaskDescendants(node)) {
                return false;
            }
        }

        return isSignificant(node);
    }

    private boolean isSignificant(UINode node) {
        List<UINode> children = node.getChildren();
        if (children.size() > config.getMinChildrenForSignificance()) {
            return true;
        }
        if (node.getType().isExtension()) {
            return true;
        }
        for (UINode child : children) {
            if (child.isExtracted()) {
                return true;
            }
        }
        return classifier.hasAnyStyle(node, config.getVisualStyleKeys()) && !children.isEmpty();
    }

    private boolean isDenied(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        for (String denied : config.getDenyNameSubstrings()) {
            if (denied != null && !denied.isEmpty() && lower.contains(denied.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }
}
