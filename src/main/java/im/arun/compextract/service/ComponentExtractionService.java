package im.arun.compextract.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import im.arun.compextract.config.ExtractorConfig;
import im.arun.compextract.extract.CandidateCollector;
import im.arun.compextract.extract.CandidateGroups;
import im.arun.compextract.extract.NodeClassifier;
import im.arun.compextract.extract.ResourceTable;
import im.arun.compextract.extract.TreeTransformer;
import im.arun.compextract.extract.VariantAnalyzer;
import im.arun.compextract.hash.StructuralHasher;
import im.arun.compextract.hash.VisualFingerprinter;
import im.arun.compextract.model.ExtractionResult;
import im.arun.compextract.model.ObjectType;
import im.arun.compextract.model.Resource;
import im.arun.compextract.model.UINode;
import im.arun.compextract.naming.NamingNormalizer;
import im.arun.compextract.naming.StateControllerSynthesizer;
import im.arun.compextract.render.RenderPipeline;
import im.arun.compextract.util.JsonLogger;
import im.arun.compextract.util.TreeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs component extraction over a root forest in four phases, each finishing before
 * the next starts:
 * <ol>
 *   <li>collect: group significant subtrees by structural hash</li>
 *   <li>analyze: detect look variants and register one resource per group</li>
 *   <li>transform: replace every instance with a reference node, inside canonical
 *       components first and then in the root forest</li>
 *   <li>finalize: normalize slot names, synthesize state controllers, snapshot canonicals</li>
 * </ol>
 * The root forest is rewritten in place.
 */
public class ComponentExtractionService {
    private static final Logger logger = LoggerFactory.getLogger(ComponentExtractionService.class);

    private final ExtractorConfig config;
    private final RenderPipeline renderPipeline;
    private final CandidateCollector candidateCollector;
    private final VariantAnalyzer variantAnalyzer;
    private final NamingNormalizer namingNormalizer;
    private final StateControllerSynthesizer stateSynthesizer;
    private final JsonLogger jsonLogger;
    private final ObjectMapper snapshotMapper;

    public ComponentExtractionService(ExtractorConfig config) {
        this(config, null);
    }

    /**
     * @param renderPipeline receives visual leaves during transform and finalize; may be null
     */
    public ComponentExtractionService(ExtractorConfig config, RenderPipeline renderPipeline) {
        this.config = config;
        this.renderPipeline = renderPipeline;
        this.candidateCollector = new CandidateCollector(
                config, new StructuralHasher(config.getShapeStyleKeys()), new NodeClassifier());
        this.variantAnalyzer = new VariantAnalyzer(config.getKeywords(), new VisualFingerprinter());
        this.namingNormalizer = new NamingNormalizer(config.getKeywords());
        this.stateSynthesizer = new StateControllerSynthesizer(
                config.getKeywords(), config.isSynthesizeVisibilityGears());
        this.jsonLogger = new JsonLogger(config.getLogDir(), "extraction");
        this.snapshotMapper = new ObjectMapper();
    }

    public ExtractionResult extract(List<UINode> roots) {
        return extract(roots, List.of());
    }

    /**
     * @param passThrough resources returned unchanged after the extracted ones
     */
    public ExtractionResult extract(List<UINode> roots, List<Resource> passThrough) {
        List<UINode> forest = roots != null ? roots : new ArrayList<>();
        jsonLogger.info("Starting component extraction", Map.of(
                "roots", forest.size(),
                "nodes", TreeUtils.countNodes(forest)));

        CandidateGroups groups = collect(forest);
        ResourceTable resourceTable = analyze(groups);
        transform(groups, forest, resourceTable);
        List<String> dropped = new ArrayList<>();
        List<Resource> resources = finalizeResources(groups, forest, resourceTable, dropped);

        if (renderPipeline != null) {
            resources.addAll(renderPipeline.producedResources());
        }
        if (passThrough != null) {
            addPassThrough(resources, passThrough);
        }

        jsonLogger.info("Component extraction complete", Map.of(
                "groups", groups.size(),
                "resources", resources.size(),
                "references", TreeUtils.findAll(forest, UINode::isAsComponent).size(),
                "dropped", dropped.size()));
        return new ExtractionResult(forest, resources, groups.size(), dropped);
    }

    private CandidateGroups collect(List<UINode> roots) {
        CandidateGroups groups = candidateCollector.collect(roots);
        jsonLogger.info("Collected candidates", Map.of(
                "groups", groups.size(),
                "instances", groups.instanceCount()));
        return groups;
    }

    private ResourceTable analyze(CandidateGroups groups) {
        ResourceTable table = new ResourceTable();
        int nextComponentId = 0;

        for (String hash : groups.hashes()) {
            List<UINode> instances = groups.instances(hash);
            Map<Integer, List<UINode>> pages = variantAnalyzer.analyze(instances);

            UINode canonical = instances.get(0);
            // Registered up front so siblings and nested components resolve each other
            Resource resource = Resource.component("comp_" + nextComponentId++, TreeUtils.safeName(canonical.getName()));
            table.register(hash, resource);

            if (instances.size() > 1) {
                logger.info("Component {} '{}' has {} instance(s) on {} page(s)",
                        resource.getId(), resource.getName(), instances.size(), pages.size());
            }
        }

        jsonLogger.info("Registered component resources", Map.of("count", table.size()));
        return table;
    }

    private void transform(CandidateGroups groups, List<UINode> roots, ResourceTable table) {
        TreeTransformer transformer = new TreeTransformer(table, config.getKeywords(), renderPipeline);
        int replaced = 0;

        for (UINode canonical : groups.canonicals()) {
            replaced += transformer.transformChildren(canonical);
        }
        for (UINode root : roots) {
            replaced += transformer.transformChildren(root);
        }

        jsonLogger.info("Replaced instances with references", Map.of("replaced", replaced));
    }

    private List<Resource> finalizeResources(CandidateGroups groups, List<UINode> roots,
                                             ResourceTable table, List<String> dropped) {
        List<UINode> canonicals = groups.canonicals();
        for (UINode canonical : canonicals) {
            canonical.setAsComponent(true);
            ObjectType type = canonical.getType();
            if (type.isExtension()) {
                canonical.setExtension(type.extensionName());
            }
            namingNormalizer.apply(canonical);
            stateSynthesizer.apply(canonical);
        }
        for (UINode root : roots) {
            stateSynthesizer.apply(root);
        }

        if (renderPipeline != null) {
            renderPipeline.scan(canonicals);
            renderPipeline.scan(roots);
        }

        List<Resource> resources = new ArrayList<>();
        for (String hash : groups.hashes()) {
            Resource resource = table.get(hash);
            UINode canonical = groups.canonical(hash);
            try {
                resource.setData(snapshotMapper.writeValueAsString(canonical));
                resources.add(resource);
            } catch (JsonProcessingException e) {
                logger.error("Failed to serialize component '{}', dropping it: {}", resource.getName(), e.getMessage());
                jsonLogger.error("Dropped component resource", Map.of(
                        "id", resource.getId(),
                        "name", resource.getName(),
                        "error", String.valueOf(e.getOriginalMessage())));
                dropped.add(resource.getId());
            }
        }
        return resources;
    }

    /**
     * Pass-through resources are kept as given. An id that is already taken is reported,
     * since references to it become ambiguous.
     */
    private void addPassThrough(List<Resource> resources, List<Resource> passThrough) {
        Set<String> ids = new HashSet<>();
        for (Resource resource : resources) {
            ids.add(resource.getId());
        }
        for (Resource resource : passThrough) {
            if (!ids.add(resource.getId())) {
                logger.warn("Pass-through resource id {} is already in use", resource.getId());
                jsonLogger.warn("Duplicate resource id", Map.of(
                        "id", String.valueOf(resource.getId()),
                        "name", String.valueOf(resource.getName())));
            }
            resources.add(resource);
        }
    }

    public JsonLogger getJsonLogger() {
        return jsonLogger;
    }
}
