package jsontree;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.logging.Logger;

final class NioJsonFiles implements JsonFiles {

    static final NioJsonFiles INSTANCE = new NioJsonFiles();

    private static final Logger LOG = Logger.getLogger(NioJsonFiles.class.getName());

    private NioJsonFiles() {}

    @Override
    public byte[] read(Path path) throws IOException {
        var bytes = Files.readAllBytes(path);
        LOG.fine(() -> "Read " + bytes.length + " bytes from " + path);
        return bytes;
    }

    @Override
    public void write(Path path, byte[] bytes) throws IOException {
        var target = path.toAbsolutePath();
        var dir = target.getParent();
        var temp = Files.createTempFile(dir, target.getFileName().toString(), ".tmp");
        try {
            Files.write(temp, bytes);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                LOG.warning(() -> "Atomic move not supported for " + target + ", falling back to a plain replace");
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException | RuntimeException e) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException suppressed) {
                e.addSuppressed(suppressed);
            }
            throw e;
        }
        LOG.fine(() -> "Wrote " + bytes.length + " bytes to " + target);
    }
}
