package com.questrail.pixeldata.model;

import java.util.List;
import java.util.Objects;

/**
 * Number of fragments in a container and the absolute position of each
 * fragment's item tag.
 */
public record FragmentIndex(List<Long> offsets)
{
    public FragmentIndex {
        offsets = List.copyOf(Objects.requireNonNull(offsets, "offsets"));
    }

    public int count() {
        return offsets.size();
    }
}
