package org.carball.placement.model.analysis;

import java.util.List;
import java.util.Optional;

/**
 * Tiering of every placement in a batch. Each placement appears in exactly one list,
 * in input order.
 */
public record Segmentation(
        List<String> effective,
        List<String> medium,
        List<String> ineffective
) {

    public Segmentation {
        effective = List.copyOf(effective);
        medium = List.copyOf(medium);
        ineffective = List.copyOf(ineffective);
    }

    public List<String> placementsFor(SegmentTag tag) {
        return switch (tag) {
            case EFFECTIVE -> effective;
            case MEDIUM -> medium;
            case INEFFECTIVE -> ineffective;
        };
    }

    public Optional<SegmentTag> tagOf(String placement) {
        for (SegmentTag tag : SegmentTag.values()) {
            if (placementsFor(tag).contains(placement)) {
                return Optional.of(tag);
            }
        }
        return Optional.empty();
    }

    public int size() {
        return effective.size() + medium.size() + ineffective.size();
    }
}
