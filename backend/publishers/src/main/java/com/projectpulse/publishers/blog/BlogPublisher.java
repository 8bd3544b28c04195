package com.projectpulse.publishers.blog;

import com.projectpulse.core.model.Destination;
import com.projectpulse.publishers.api.PermanentPublishException;
import com.projectpulse.publishers.api.PublishException;
import com.projectpulse.publishers.api.PublishOutcome;
import com.projectpulse.publishers.api.Publisher;
import com.projectpulse.publishers.api.RetryablePublishException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.Locale;
import java.util.logging.Logger;

/**
 * Writes each post as a dated Markdown file with front matter into a static-site posts directory.
 * Publishing and deploying the site is left to the site's own tooling.
 */
public class BlogPublisher implements Publisher {
    private static final Logger LOGGER = Logger.getLogger(BlogPublisher.class.getName());
    private static final DateTimeFormatter FRONT_MATTER_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss Z");
    private static final int MAX_SLUG_LENGTH = 50;

    private final Path postsDirectory;
    private final String siteUrl;
    private final String author;
    private final Clock clock;
    private final ZoneId zone;

    public BlogPublisher(Path postsDirectory, String siteUrl, String author, Clock clock, ZoneId zone) {
        this.postsDirectory = postsDirectory;
        this.siteUrl = siteUrl == null || siteUrl.isBlank() ? null : siteUrl.replaceAll("/+$", "");
        this.author = author;
        this.clock = clock;
        this.zone = zone;
    }

    @Override
    public String name() {
        return "blog";
    }

    @Override
    public Destination destination() {
        return Destination.BLOG;
    }

    @Override
    public PublishOutcome publish(String content) throws PublishException {
        ZonedDateTime now = ZonedDateTime.now(clock.withZone(zone));
        String[] lines = content.strip().split("\n", -1);
        String title;
        String body;
        if (lines.length > 0 && lines[0].startsWith("#")) {
            title = lines[0].replaceAll("^#+", "").strip();
            body = String.join("\n", Arrays.copyOfRange(lines, 1, lines.length)).strip();
        } else {
            title = "Update " + now.toLocalDate();
            body = content.strip();
        }

        String baseName = now.toLocalDate() + "-" + slug(title);
        Path target = postsDirectory.resolve(baseName + ".md");
        try {
            Files.createDirectories(postsDirectory);
            Path tmp = postsDirectory.resolve(baseName + ".md.tmp");
            Files.writeString(tmp, frontMatter(title, now) + body + "\n", StandardCharsets.UTF_8);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new RetryablePublishException("Failed writing blog post " + target, e);
        }
        LOGGER.info(() -> "Wrote blog post " + target);
        return PublishOutcome.published(siteUrl == null ? target.getFileName().toString() : siteUrl + "/" + baseName + "/");
    }

    @Override
    public void checkConnection() throws PublishException {
        try {
            Files.createDirectories(postsDirectory);
        } catch (IOException e) {
            throw new PermanentPublishException("Cannot create posts directory " + postsDirectory, e);
        }
        if (!Files.isWritable(postsDirectory)) {
            throw new PermanentPublishException("Posts directory is not writable: " + postsDirectory);
        }
    }

    private String frontMatter(String title, ZonedDateTime now) {
        StringBuilder out = new StringBuilder();
        out.append("---\n");
        out.append("layout: post\n");
        out.append("title: \"").append(title.replace("\\", "\\\\").replace("\"", "\\\"")).append("\"\n");
        out.append("date: ").append(FRONT_MATTER_DATE.format(now)).append('\n');
        out.append("categories: [weekly-update]\n");
        if (author != null && !author.isBlank()) {
            out.append("author: ").append(author).append('\n');
        }
        out.append("---\n\n");
        return out.toString();
    }

    static String slug(String title) {
        StringBuilder out = new StringBuilder();
        for (char c : title.toLowerCase(Locale.ROOT).toCharArray()) {
            out.append(Character.isLetterOrDigit(c) && c < 128 ? c : '-');
        }
        String collapsed = out.toString().replaceAll("-+", "-").replaceAll("^-|-$", "");
        if (collapsed.isEmpty()) {
            return "post";
        }
        return collapsed.length() <= MAX_SLUG_LENGTH
                ? collapsed
                : collapsed.substring(0, MAX_SLUG_LENGTH).replaceAll("-$", "");
    }
}
