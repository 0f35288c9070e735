package im.arun.compextract.extract;

import im.arun.compextract.config.KeywordTable;
import im.arun.compextract.hash.VisualFingerprinter;
import im.arun.compextract.model.GearInfo;
import im.arun.compextract.model.LookVariant;
import im.arun.compextract.model.ObjectType;
import im.arun.compextract.model.UINode;
import im.arun.compextract.naming.StateRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Detects appearance variants inside a structural group ("same shape, different skin")
 * and assigns every instance the look page it renders.
 *
 * <p>Page 0 always belongs to the canonical instance's look. Other looks take the page
 * of the interaction state their name refers to when that page is still free, else the
 * next free page counting from 1. The canonical node records every non-default look by
 * the source id of the instance that renders it.
 */
public class VariantAnalyzer {
    private static final Logger logger = LoggerFactory.getLogger(VariantAnalyzer.class);

    public static final String BUTTON_CONTROLLER = "button";
    public static final String STATE_CONTROLLER = "state";

    private final KeywordTable keywords;
    private final VisualFingerprinter fingerprinter;

    public VariantAnalyzer(KeywordTable keywords, VisualFingerprinter fingerprinter) {
        this.keywords = keywords;
        this.fingerprinter = fingerprinter;
    }

    /**
     * Analyze one group and tag its instances with their page ids.
     *
     * @param instances group instances, canonical first
     * @return instances per assigned page id
     */
    public Map<Integer, List<UINode>> analyze(List<UINode> instances) {
        Map<Integer, List<UINode>> pages = new LinkedHashMap<>();
        if (instances == null || instances.isEmpty()) {
            return pages;
        }

        UINode canonical = instances.get(0);
        canonical.setVariantPageId(0);
        if (instances.size() < 2) {
            pages.put(0, new ArrayList<>(instances));
            return pages;
        }

        Map<String, List<UINode>> clusters = new LinkedHashMap<>();
        for (UINode instance : instances) {
            clusters.computeIfAbsent(fingerprinter.fingerprint(instance), f -> new ArrayList<>()).add(instance);
        }

        Map<Integer, String> pageNames = new TreeMap<>();
        if (clusters.size() == 1) {
            assignByName(instances, pages, pageNames);
        } else {
            assignByLook(canonical, clusters, pages, pageNames);
        }

        // References may only point at pages the canonical can switch to
        if (!pageNames.isEmpty()) {
            canonical.setVariantPageNames(pageNames);
            ensureIconGear(canonical);
        }
        return pages;
    }

    /**
     * Visually identical instances only leave page 0 when their name names a state.
     */
    private void assignByName(List<UINode> instances, Map<Integer, List<UINode>> pages,
                              Map<Integer, String> pageNames) {
        for (int i = 0; i < instances.size(); i++) {
            UINode instance = instances.get(i);
            int pageId = 0;
            if (i > 0) {
                StateRole role = keywords.detectState(instance.getName());
                if (role != null && role.getPageId() > 0) {
                    pageId = role.getPageId();
                    pageNames.putIfAbsent(pageId, role.getPageName());
                    logger.debug("'{}' placed on page {} by name", instance.getName(), pageId);
                }
            }
            instance.setVariantPageId(pageId);
            pages.computeIfAbsent(pageId, p -> new ArrayList<>()).add(instance);
        }
    }

    private void assignByLook(UINode canonical, Map<String, List<UINode>> clusters,
                              Map<Integer, List<UINode>> pages, Map<Integer, String> pageNames) {
        String canonicalFingerprint = fingerprinter.fingerprint(canonical);
        Set<Integer> taken = new HashSet<>();
        taken.add(0);
        int nextSequential = 1;

        for (Map.Entry<String, List<UINode>> cluster : clusters.entrySet()) {
            List<UINode> members = cluster.getValue();
            int pageId;

            if (cluster.getKey().equals(canonicalFingerprint)) {
                pageId = 0;
            } else {
                UINode representative = members.get(0);
                StateRole role = keywords.detectState(representative.getName());
                if (role != null && role.getPageId() > 0 && !taken.contains(role.getPageId())) {
                    pageId = role.getPageId();
                    pageNames.put(pageId, role.getPageName());
                } else {
                    while (taken.contains(nextSequential)) {
                        nextSequential++;
                    }
                    pageId = nextSequential;
                    pageNames.put(pageId, "Look" + pageId);
                }
                taken.add(pageId);
                canonical.multiLooksOrCreate().put(pageId, LookVariant.ofSource(representative.getRenderId()));
                logger.debug("Look variant of '{}' on page {} from '{}'",
                        canonical.getName(), pageId, representative.getName());
            }

            for (UINode member : members) {
                member.setVariantPageId(pageId);
            }
            pages.computeIfAbsent(pageId, p -> new ArrayList<>()).addAll(members);
        }
    }

    /**
     * Exactly one icon-switching gear per canonical node that has looks.
     */
    private void ensureIconGear(UINode canonical) {
        String controller = canonical.getType() == ObjectType.BUTTON ? BUTTON_CONTROLLER : STATE_CONTROLLER;
        List<GearInfo> gears = canonical.gearsOrCreate();
        gears.removeIf(gear -> GearInfo.GEAR_ICON.equals(gear.getType()));
        gears.add(new GearInfo(GearInfo.GEAR_ICON, controller));
    }
}
