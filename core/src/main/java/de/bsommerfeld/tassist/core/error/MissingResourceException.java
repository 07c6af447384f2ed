package de.bsommerfeld.tassist.core.error;

/**
 * A plugin or handler required a resource that no earlier plugin registered.
 * Usually means plugins were added in the wrong order.
 */
public class MissingResourceException extends FrameworkException {

    private final Class<?> resourceType;

    public MissingResourceException(Class<?> resourceType) {
        super("missing resource: " + resourceType.getName());
        this.resourceType = resourceType;
    }

    public Class<?> getResourceType() {
        return resourceType;
    }
}
