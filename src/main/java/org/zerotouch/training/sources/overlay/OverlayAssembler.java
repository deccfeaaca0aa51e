package org.zerotouch.training.sources.overlay;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zerotouch.training.sources.MalformedSourceException;
import org.zerotouch.training.sources.overlay.models.OverlayFile;
import org.zerotouch.training.sources.overlay.models.OverlayResolution;
import org.zerotouch.training.sources.overlay.models.RawOverlayRule;
import org.zerotouch.training.sources.overlay.models.ResolvedOverlay;
import org.zerotouch.training.sources.overlay.models.SiteInfo;
import org.zerotouch.training.sources.overlay.models.Variation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Loads site overlay files and resolves them into the structure content generators consume.
 * <p>
 * Overlays are a parallel "site lens": they never modify parsed test scripts or processes,
 * generators join them by transaction code.
 * <p>
 * Call {@link #load()} once before any reads. The assembler is not safe for a {@code load()}
 * running concurrently with {@link #resolve(String)}; once loading is done it can be read from any thread.
 */
public class OverlayAssembler {
    private static final Logger log = LoggerFactory.getLogger(OverlayAssembler.class);

    static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private final List<Path> overlayPaths;
    private final List<RawOverlayRule> rawOverlays = new ArrayList<>();
    private SiteInfo siteInfo = new SiteInfo();

    public OverlayAssembler(List<Path> overlayPaths) {
        this.overlayPaths = List.copyOf(overlayPaths);
    }

    /**
     * Loads all overlay files in order. Missing files are skipped with a warning. Rules are concatenated
     * across files without deduplication; the last file with a {@code site} block supplies the site.
     *
     * @throws MalformedSourceException if a file is not valid YAML or does not match the overlay structure
     */
    public void load() {
        for (Path path : overlayPaths) {
            if (!Files.exists(path)) {
                log.warn("Overlay file not found: {}", path);
                continue;
            }

            OverlayFile overlayFile = readOverlayFile(path);
            int ruleCount = 0;
            if (overlayFile != null) {
                if (overlayFile.site != null) {
                    siteInfo = overlayFile.site;
                }
                if (overlayFile.overlays != null) {
                    overlayFile.overlays.stream().filter(Objects::nonNull).forEach(rawOverlays::add);
                    ruleCount = overlayFile.overlays.size();
                }
            }
            log.info("Loaded overlay: {} ({} rules)", path.getFileName(), ruleCount);
        }
    }

    /**
     * Projects every loaded rule into normalized form. Each variation always carries type,
     * enterprise_default, site_override and reason; the optional keys are copied only when the
     * source variation has them. Returns a new structure on every call.
     *
     * @param role target role; accepted but not applied, reserved for per-role filtering
     * @return the resolved overlays, {@code {site: {}, overlays: []}} when nothing was loaded
     */
    public OverlayResolution resolve(String role) {
        List<ResolvedOverlay> resolved = new ArrayList<>();
        for (RawOverlayRule rule : rawOverlays) {
            List<Variation> variations = new ArrayList<>();
            for (Variation variation : variationsOf(rule)) {
                variations.add(resolveVariation(variation));
            }
            resolved.add(new ResolvedOverlay(
                    rule.process == null ? "" : rule.process,
                    rule.transaction == null ? "" : rule.transaction,
                    variations));
        }
        return new OverlayResolution(siteInfo.copy(), resolved);
    }

    public OverlayResolution resolve() {
        return resolve("");
    }

    /**
     * Gets copies of the raw variations of every rule for a transaction code (exact, case-sensitive match).
     *
     * @param transactionCode transaction code, e.g. "ME51N"
     * @return the variations, empty if no rule matches
     */
    public List<Variation> getOverlaysForTransaction(String transactionCode) {
        List<Variation> results = new ArrayList<>();
        for (RawOverlayRule rule : rawOverlays) {
            if (Objects.equals(rule.transaction, transactionCode)) {
                variationsOf(rule).forEach(variation -> results.add(variation.copy()));
            }
        }
        return results;
    }

    /**
     * Field-level constraints: variations that name a {@code field}.
     */
    public List<Variation> getFieldConstraints(String transactionCode) {
        return getOverlaysForTransaction(transactionCode).stream()
                .filter(v -> v.has(Variation.FIELD))
                .toList();
    }

    public List<Variation> getProcessGates(String transactionCode) {
        return getOverlaysForTransaction(transactionCode).stream()
                .filter(v -> Variation.TYPE_PROCESS_GATE.equals(v.get(Variation.TYPE)))
                .toList();
    }

    public List<Variation> getApprovalRules(String transactionCode) {
        return getOverlaysForTransaction(transactionCode).stream()
                .filter(v -> Variation.TYPE_APPROVAL_RULE.equals(v.get(Variation.TYPE)))
                .toList();
    }

    public SiteInfo getSiteInfo() {
        return siteInfo.copy();
    }

    /**
     * Copies of the loaded rules, in load order.
     */
    public List<RawOverlayRule> getRawOverlays() {
        return rawOverlays.stream().map(RawOverlayRule::copy).toList();
    }

    private static Variation resolveVariation(Variation variation) {
        Map<String, Object> resolved = new LinkedHashMap<>();
        resolved.put(Variation.TYPE, valueOrEmpty(variation, Variation.TYPE));
        resolved.put(Variation.ENTERPRISE_DEFAULT, valueOrEmpty(variation, Variation.ENTERPRISE_DEFAULT));
        resolved.put(Variation.SITE_OVERRIDE, valueOrEmpty(variation, Variation.SITE_OVERRIDE));
        resolved.put(Variation.REASON, valueOrEmpty(variation, Variation.REASON));

        if (variation.has(Variation.FIELD)) {
            resolved.put(Variation.FIELD, variation.get(Variation.FIELD));
            resolved.put(Variation.FIELD_TECHNICAL, valueOrEmpty(variation, Variation.FIELD_TECHNICAL));
        }
        for (String key : List.of(Variation.STEP, Variation.TIERS, Variation.CONDITION,
                Variation.ACTIONS, Variation.TEMPERATURE_RANGES)) {
            if (variation.has(key)) {
                resolved.put(key, variation.get(key));
            }
        }
        // nested tiers, actions and ranges must not alias the loaded rule
        return new Variation(resolved).copy();
    }

    private static Object valueOrEmpty(Variation variation, String key) {
        return variation.has(key) ? variation.get(key) : "";
    }

    private static List<Variation> variationsOf(RawOverlayRule rule) {
        if (rule.variations == null) {
            return List.of();
        }
        return rule.variations.stream().filter(Objects::nonNull).toList();
    }

    private static OverlayFile readOverlayFile(Path path) {
        try {
            JsonNode tree = YAML_MAPPER.readTree(path.toFile());
            if (tree == null || tree.isMissingNode() || tree.isNull()) {
                return null;
            }
            return YAML_MAPPER.treeToValue(tree, OverlayFile.class);
        } catch (JsonProcessingException e) {
            throw new MalformedSourceException("Malformed overlay " + path + ": " + e.getOriginalMessage(),
                    path.toString(), e);
        } catch (IOException e) {
            throw new MalformedSourceException("Failed to read overlay " + path, path.toString(), e);
        }
    }
}
