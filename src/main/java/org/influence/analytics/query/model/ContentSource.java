package org.influence.analytics.query.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Union of content branches exposed to the outer query as alias {@code c}.
 * <p>
 * By default content rows drive the query and are inner-joined to matching profiles
 * ({@code t}). When profile-driven, every matching profile is kept and content is
 * left-joined to it, so profiles without posts in the window still count.
 * <p>
 * Content tables hold repeated snapshot rows per media; each branch keeps one row per
 * {@code media_id}, so the media id is always projected.
 */
public final class ContentSource {

    private final List<ContentBranch> branches;
    private final List<ContentColumn> columns;
    private final boolean profileDriven;

    public ContentSource(List<ContentBranch> branches, List<ContentColumn> columns, boolean profileDriven) {
        if (branches.isEmpty()) {
            throw new IllegalArgumentException("Content source needs at least one branch");
        }
        this.branches = List.copyOf(branches);
        List<ContentColumn> projected = new ArrayList<>(columns);
        if (!projected.contains(ContentColumn.MEDIA_ID)) {
            projected.add(0, ContentColumn.MEDIA_ID);
        }
        this.columns = List.copyOf(projected);
        this.profileDriven = profileDriven;
    }

    public List<ContentBranch> getBranches() {
        return branches;
    }

    public List<ContentColumn> getColumns() {
        return columns;
    }

    public boolean isProfileDriven() {
        return profileDriven;
    }
}
