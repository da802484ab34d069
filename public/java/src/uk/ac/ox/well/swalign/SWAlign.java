package uk.ac.ox.well.swalign;

public class SWAlign {
    public static final String progName = "SWAlign";
    public static final String progDesc = "local alignment of two sequences with affine gap penalties";
    public static final String rootPackage = "uk.ac.ox.well.swalign";

    public static void main(String[] args) {
        Main.start(progName, progDesc, rootPackage, args);
    }
}
