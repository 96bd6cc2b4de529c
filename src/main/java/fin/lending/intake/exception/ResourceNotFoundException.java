package fin.lending.intake.exception;

/**
 * A referenced entity does not exist
 */
public abstract class ResourceNotFoundException extends BusinessException {

    private final String resource;
    private final String key;

    protected ResourceNotFoundException(String resource, String key, String message) {
        super(message);
        this.resource = resource;
        this.key = key;
    }

    public String getResource() {
        return resource;
    }

    public String getKey() {
        return key;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.NOT_FOUND;
    }
}
