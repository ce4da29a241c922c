package statemigrator.pipeline;

import java.util.Objects;

/**
 * One unit of work: a repository in an organization, migrated on a branch.
 *
 * @param organization the owning organization
 * @param name the repository name
 * @param branch the branch the migration is committed to
 */
public record RepositoryTarget(String organization, String name, String branch) {

    public RepositoryTarget {
        Objects.requireNonNull(organization, "organization");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(branch, "branch");
    }

    /** Returns {@code organization/name}. */
    public String fullName() {
        return organization + "/" + name;
    }

    @Override
    public String toString() {
        return fullName() + "@" + branch;
    }
}
