package com.openclaw.webui.gateway.relay;

import com.openclaw.webui.gateway.protocol.ControlFrames.Attachment;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Boundary checks for attachments on a browser {@code send}.
 * Entries without data are dropped, oversize entries are dropped, and only the
 * first {@link #MAX_ATTACHMENTS} survivors are kept. MIME types outside the
 * whitelist are logged but allowed through.
 */
@Slf4j
public final class AttachmentPolicy {

    public static final int MAX_ATTACHMENTS = 5;
    public static final long MAX_ATTACHMENT_BYTES = 10L * 1024 * 1024;

    public static final Set<String> MIME_WHITELIST = Set.of(
            "image/png", "image/jpeg", "image/gif", "image/webp",
            "application/pdf", "text/plain", "text/markdown",
            "text/javascript", "text/typescript", "text/css", "application/json");

    private AttachmentPolicy() {
    }

    public static List<Attachment> filter(List<Attachment> attachments) {
        List<Attachment> valid = new ArrayList<>();
        if (attachments == null) {
            return valid;
        }
        for (Attachment att : attachments) {
            if (att == null || att.data() == null || att.data().isEmpty()) {
                continue;
            }
            long size = effectiveSize(att);
            if (size > MAX_ATTACHMENT_BYTES) {
                log.warn("attachment:too-large filename={} size={}", att.filename(), size);
                continue;
            }
            if (att.mimeType() != null && !MIME_WHITELIST.contains(att.mimeType())) {
                log.warn("attachment:mime-not-whitelisted filename={} mimeType={} (allowed)",
                        att.filename(), att.mimeType());
            }
            if (valid.size() == MAX_ATTACHMENTS) {
                log.warn("attachment:limit dropping filename={} max={}", att.filename(), MAX_ATTACHMENTS);
                continue;
            }
            valid.add(att);
        }
        return valid;
    }

    /**
     * Declared size, or the decoded size of the base64 data when none was sent.
     */
    static long effectiveSize(Attachment att) {
        if (att.size() != null && att.size() > 0) {
            return att.size();
        }
        String data = att.data();
        int padding = data.endsWith("==") ? 2 : data.endsWith("=") ? 1 : 0;
        return (long) data.length() * 3 / 4 - padding;
    }
}
