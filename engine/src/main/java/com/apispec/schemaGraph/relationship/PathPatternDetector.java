package com.apispec.schemaGraph.relationship;

import com.apispec.schemaGraph.catalog.OperationDescriptor;
import com.apispec.schemaGraph.naming.EntityNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Nested resource paths: {@code /users/{userId}/orders} means User {@code hasMany} Order,
 * {@code /users/{userId}/profile} means User {@code hasOne} Profile. Every
 * static/parameter/static triple in a path is inspected.
 *
 * A singular segment only counts when it names a known entity or schema, which keeps
 * action segments such as {@code /pets/{petId}/uploadImage} out of the graph.
 */
public class PathPatternDetector implements RelationshipDetector {
    private static final Logger logger = LoggerFactory.getLogger(PathPatternDetector.class);

    @Override
    public DetectionSource source() {
        return DetectionSource.PATH_PATTERN;
    }

    @Override
    public List<RelationshipCandidate> detect(DetectionContext context) {
        Set<String> paths = new LinkedHashSet<>();
        for (OperationDescriptor operation : context.catalog().allOperations()) {
            paths.add(operation.rawPath());
        }

        List<RelationshipCandidate> candidates = new ArrayList<>();
        for (String path : paths) {
            List<String> segments = segments(path);
            for (int i = 0; i + 2 < segments.size(); i++) {
                String parentSegment = segments.get(i);
                String childSegment = segments.get(i + 2);
                if (isParameter(parentSegment) || !isParameter(segments.get(i + 1)) || isParameter(childSegment)) {
                    continue;
                }

                String parent = entityFor(context, parentSegment);
                String child = entityFor(context, childSegment);
                if (parent == null || child == null || parent.equals(child)) {
                    continue;
                }

                RelationshipType type = EntityNames.isPlural(childSegment) ? RelationshipType.HAS_MANY : RelationshipType.HAS_ONE;
                candidates.add(new RelationshipCandidate(parent, child, type,
                        new Evidence(DetectionSource.PATH_PATTERN, "paths." + path,
                                "Nested resource path: " + parent + " " + type.getValue() + " " + child)));
            }
        }

        logger.debug("Path patterns produced {} candidates", candidates.size());
        return candidates;
    }

    private String entityFor(DetectionContext context, String segment) {
        String derived = EntityNames.entityNameForSegment(segment);
        if (derived.isEmpty()) {
            return null;
        }
        String known = context.canonicalEntity(derived);
        if (known != null) {
            return known;
        }
        return EntityNames.isPlural(segment) ? derived : null;
    }

    private static List<String> segments(String path) {
        List<String> segments = new ArrayList<>();
        for (String segment : path.split("/")) {
            if (!segment.isBlank()) {
                segments.add(segment);
            }
        }
        return segments;
    }

    private static boolean isParameter(String segment) {
        return segment.contains("{");
    }
}
