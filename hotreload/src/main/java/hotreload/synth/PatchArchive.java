package hotreload.synth;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.jar.JarEntry;
import java.util.jar.JarInputStream;

/**
 * A patch jar read back from disk: its manifest and class files.
 */
public final class PatchArchive {

    private final Path path;
    private final PatchManifest manifest;
    private final Map<String, byte[]> classes;

    private PatchArchive(Path path, PatchManifest manifest, Map<String, byte[]> classes) {
        this.path = path;
        this.manifest = manifest;
        this.classes = Collections.unmodifiableMap(classes);
    }

    public static PatchArchive read(Path jarPath) throws IOException {
        PatchManifest manifest = null;
        Map<String, byte[]> classes = new TreeMap<>();
        try (InputStream in = Files.newInputStream(jarPath);
             JarInputStream jar = new JarInputStream(in)) {
            JarEntry entry;
            while ((entry = jar.getNextJarEntry()) != null) {
                String name = entry.getName();
                if (name.equals(PatchManifest.ENTRY)) {
                    try {
                        manifest = PatchManifest.fromYaml(new String(jar.readAllBytes(), StandardCharsets.UTF_8), jarPath);
                    } catch (IllegalArgumentException e) {
                        throw new IOException("Invalid patch manifest in " + jarPath + ": " + e.getMessage(), e);
                    }
                } else if (name.endsWith(".class")) {
                    classes.put(name.substring(0, name.length() - ".class".length()), jar.readAllBytes());
                }
            }
        }
        if (manifest == null) {
            throw new IOException("Not a patch module (no " + PatchManifest.ENTRY + "): " + jarPath);
        }
        return new PatchArchive(jarPath, manifest, classes);
    }

    /**
     * Rebuilds the in-memory patch module.
     */
    public PatchModule toPatchModule() {
        PatchNaming naming = new PatchNaming(manifest.module(), manifest.sequence(), path);
        return new PatchModule(naming, classes, manifest.classes(), manifest.methods(), manifest.newTypes(),
                manifest.initializers(), manifest.failures(), manifest.requires());
    }

    public Path path() {
        return path;
    }

    public PatchManifest manifest() {
        return manifest;
    }

    public Map<String, byte[]> classes() {
        return classes;
    }
}
