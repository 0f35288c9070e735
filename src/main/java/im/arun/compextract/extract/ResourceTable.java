package im.arun.compextract.extract;

import im.arun.compextract.model.Resource;
import im.arun.compextract.model.UINode;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Component resources keyed by the structural hash of their group.
 */
public class ResourceTable {

    private final Map<String, Resource> byHash = new LinkedHashMap<>();

    public void register(String hash, Resource resource) {
        if (byHash.containsKey(hash)) {
            throw new IllegalStateException("Resource already registered for hash " + hash);
        }
        byHash.put(hash, resource);
    }

    public Resource get(String hash) {
        return byHash.get(hash);
    }

    /**
     * Look up the resource of an extracted node through the hash cached at collection time.
     */
    public Resource resolve(UINode node) {
        String hash = node.getStructuralHash();
        Resource resource = hash != null ? byHash.get(hash) : null;
        if (resource == null) {
            throw new ReferenceResolutionException(node.getId(), node.getName(), hash);
        }
        return resource;
    }

    public int size() {
        return byHash.size();
    }
}
