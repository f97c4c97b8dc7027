package org.pram4j.runtime.model;

/**
 * Thrown when an attribute or relation of a registered group is written without the force flag.
 * All changes to registered groups are meant to flow through split specs.
 */
public class GroupFrozenException extends IllegalStateException {

    private final String groupName;

    public GroupFrozenException(String groupName, String key) {
        super(String.format("Group '%s' is registered in a population and cannot be mutated (key '%s'); "
                + "return a split spec instead or use the force flag", groupName, key));
        this.groupName = groupName;
    }

    public String getGroupName() {
        return groupName;
    }
}
