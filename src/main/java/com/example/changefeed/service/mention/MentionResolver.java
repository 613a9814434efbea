package com.example.changefeed.service.mention;

import com.example.changefeed.model.domain.AppUser;
import com.example.changefeed.model.domain.NotificationType;
import com.example.changefeed.model.dto.CommentContext;
import com.example.changefeed.service.user.UserDirectory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Works out who should be notified about a piece of comment content.
 *
 * A mention is {@code @} followed by 1-50 letters, digits or underscores,
 * at the start of the text or after whitespace, so e-mail addresses such as
 * {@code a@b.com} are not mentions. Names are matched case-insensitively;
 * names that match no user stay plain text.
 *
 * Resolution only reads the user directory. Persisting the resulting
 * notifications is up to the caller.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MentionResolver {

    static final Pattern MENTION_PATTERN = Pattern.compile("(?<!\\S)@([A-Za-z0-9_]{1,50})(?![A-Za-z0-9_])");

    private final UserDirectory userDirectory;

    /**
     * Extracts mentioned usernames in order of first appearance, without
     * duplicates (compared case-insensitively) and without the {@code @}.
     */
    public static List<String> parseMentions(String content) {
        if (content == null || content.isEmpty()) {
            return List.of();
        }
        Matcher matcher = MENTION_PATTERN.matcher(content);
        Set<String> seen = new HashSet<>();
        List<String> usernames = new ArrayList<>();
        while (matcher.find()) {
            String username = matcher.group(1);
            if (seen.add(username.toLowerCase(Locale.ROOT))) {
                usernames.add(username);
            }
        }
        return usernames;
    }

    /**
     * Resolves the audience of a comment.
     *
     * @param content comment text
     * @param context author and reply context of the comment
     * @return mentioned users (type mention) plus the parent comment's author
     *         (type reply), never including the comment's own author
     */
    public Set<Recipient> resolve(String content, CommentContext context) {
        Objects.requireNonNull(context, "context");
        Long authorId = context.commentAuthorId();
        Set<Recipient> recipients = new LinkedHashSet<>();

        List<String> usernames = parseMentions(content);
        if (!usernames.isEmpty()) {
            List<AppUser> users = userDirectory.findByUsernames(usernames);
            if (users.size() < usernames.size()) {
                log.debug("{} of {} mentions did not match a user", usernames.size() - users.size(), usernames.size());
            }
            for (AppUser user : users) {
                if (!Objects.equals(user.getId(), authorId)) {
                    recipients.add(new Recipient(user.getId(), NotificationType.MENTION));
                }
            }
        }

        if (context.isReply() && !Objects.equals(context.parentCommentAuthorId(), authorId)) {
            recipients.add(new Recipient(context.parentCommentAuthorId(), NotificationType.REPLY));
        }
        return Collections.unmodifiableSet(recipients);
    }
}
