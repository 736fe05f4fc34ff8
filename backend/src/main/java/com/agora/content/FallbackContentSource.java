package com.agora.content;

import com.agora.exception.TransientContentException;
import lombok.extern.slf4j.Slf4j;

/**
 * Two-attempt policy: the primary source, then exactly one attempt on the backup.
 * Both results go through the {@link UtteranceSanitizer}.
 */
@Slf4j
public class FallbackContentSource implements ContentSource {

    private final ContentSource primary;
    private final ContentSource backup;
    private final UtteranceSanitizer sanitizer;

    public FallbackContentSource(ContentSource primary, ContentSource backup, UtteranceSanitizer sanitizer) {
        this.primary = primary;
        this.backup = backup;
        this.sanitizer = sanitizer;
    }

    @Override
    public String generate(ContentRequest request) {
        try {
            return sanitizer.clean(primary.generate(request), request.getPersona());
        } catch (TransientContentException e) {
            log.warn("Primary source {} failed: {}", primary.name(), e.getMessage());
        }
        try {
            return sanitizer.clean(backup.generate(request), request.getPersona());
        } catch (TransientContentException e) {
            log.warn("Backup source {} failed: {}", backup.name(), e.getMessage());
            throw new TransientContentException(
                    "Both " + primary.name() + " and " + backup.name() + " failed", e);
        }
    }

    @Override
    public String name() {
        return primary.name() + "+" + backup.name();
    }
}
