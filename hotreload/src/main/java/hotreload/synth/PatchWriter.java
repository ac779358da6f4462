package hotreload.synth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.jar.Attributes;
import java.util.jar.JarEntry;
import java.util.jar.JarOutputStream;
import java.util.jar.Manifest;

/**
 * Writes a patch module to its jar.
 *
 * <p>Entries are written in name order with a fixed timestamp. The jar is
 * written to a temporary file first and moved into place, so a reader never
 * sees a partial patch.
 */
public final class PatchWriter {

    private static final Logger log = LoggerFactory.getLogger(PatchWriter.class);

    // 1980-01-01T00:00:00Z, the earliest time a zip entry can hold
    private static final long ENTRY_TIME = 315532800000L;

    public Path write(PatchModule patch) throws IOException {
        Path target = patch.jarPath();
        Files.createDirectories(target.toAbsolutePath().getParent());
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");

        Manifest manifest = new Manifest();
        manifest.getMainAttributes().put(Attributes.Name.MANIFEST_VERSION, "1.0");
        manifest.getMainAttributes().putValue("Created-By", "hotreload");
        manifest.getMainAttributes().putValue("Hotreload-Module", patch.module());
        manifest.getMainAttributes().putValue("Hotreload-Sequence", Long.toString(patch.sequence()));

        try (OutputStream out = Files.newOutputStream(tmp);
             JarOutputStream jar = new JarOutputStream(out)) {
            putEntry(jar, "META-INF/MANIFEST.MF", manifestBytes(manifest));
            putEntry(jar, PatchManifest.ENTRY, PatchManifest.of(patch).toYaml().getBytes(StandardCharsets.UTF_8));
            for (Map.Entry<String, byte[]> e : patch.classes().entrySet()) {
                putEntry(jar, e.getKey() + ".class", e.getValue());
            }
        }
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        log.debug("Wrote patch module {} ({} classes)", target, patch.classes().size());
        return target;
    }

    private static byte[] manifestBytes(Manifest manifest) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        manifest.write(bytes);
        return bytes.toByteArray();
    }

    private static void putEntry(JarOutputStream jar, String name, byte[] data) throws IOException {
        JarEntry entry = new JarEntry(name);
        entry.setTime(ENTRY_TIME);
        jar.putNextEntry(entry);
        jar.write(data);
        jar.closeEntry();
    }
}
