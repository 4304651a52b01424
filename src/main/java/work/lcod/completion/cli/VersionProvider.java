package work.lcod.completion.cli;

import picocli.CommandLine;

final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        String implementationVersion = Main.class.getPackage().getImplementationVersion();
        return new String[] { "lcod-complete " + (implementationVersion != null ? implementationVersion : "development") };
    }
}
