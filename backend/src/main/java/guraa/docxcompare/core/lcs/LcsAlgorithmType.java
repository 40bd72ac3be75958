package guraa.docxcompare.core.lcs;

public enum LcsAlgorithmType {
    HUNT_SZYMANSKI,
    DYNAMIC_PROGRAMMING;

    public LcsAlgorithm create() {
        switch (this) {
            case DYNAMIC_PROGRAMMING:
                return new DynamicProgrammingLcs();
            case HUNT_SZYMANSKI:
            default:
                return new HuntSzymanskiLcs();
        }
    }
}
