package db.tpch.integrity;

// An entity registered before one of the entities it references.
public class OutOfOrderLoad extends IntegrityViolation {
    private final String missingDependency;

    public OutOfOrderLoad(String entity, String missingDependency) {
        super(entity, null, "Cannot load " + entity + " before " + missingDependency + " is fully loaded");
        this.missingDependency = missingDependency;
    }

    public String missingDependency() { return missingDependency; }
}
