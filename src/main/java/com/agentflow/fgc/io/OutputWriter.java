package com.agentflow.fgc.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.agentflow.fgc.emit.EmitResult;
import com.agentflow.fgc.emit.EmittedFile;

import lombok.extern.log4j.Log4j2;

/**
 * Writes emitted files below an output directory.
 */
@Log4j2
public final class OutputWriter {
    private final boolean overwrite;

    public OutputWriter(boolean overwrite) {
        this.overwrite = overwrite;
    }

    /**
     * Writes every file of the result. Existing files are only replaced when
     * the writer was created with {@code overwrite}.
     *
     * @return the paths written, in emission order
     */
    public List<Path> write(EmitResult result, Path outputDir) throws IOException {
        Path root = outputDir.toAbsolutePath().normalize();
        List<Path> written = new ArrayList<>(result.files().size());
        for (EmittedFile file : result.files()) {
            Path target = root.resolve(file.path()).normalize();
            if (!target.startsWith(root))
                throw new IOException("Refusing to write outside " + root + ": " + file.path());
            if (Files.exists(target) && !overwrite)
                throw new FileAlreadyExistsException(target.toString());
            if (target.getParent() != null)
                Files.createDirectories(target.getParent());
            Files.writeString(target, file.content(), StandardCharsets.UTF_8);
            written.add(target);
            log.debug("Wrote {} ({} chars)", target, file.content().length());
        }
        log.info("Wrote {} files to {}", written.size(), root);
        return written;
    }
}
