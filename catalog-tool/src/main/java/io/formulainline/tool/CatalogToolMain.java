package io.formulainline.tool;

/** Process entry point; exits with the code returned by {@link CatalogTool#run}. */
public final class CatalogToolMain {

    private CatalogToolMain() {
        // utility class
    }

    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        System.exit(new CatalogTool(System.out, System.err, System::getenv).run(args));
    }
}
