package ai.sensor.scan;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-level patterns for the security-relevant source features. Tuned for C-family code,
 * which is what the diffed components are written in.
 */
final class SourcePatterns {

    static final Pattern ALLOC_CALL = Pattern.compile(
            "\\b(?:malloc|calloc|realloc|reallocf|reallocarray|mallocarray|valloc|aligned_alloc|alloca"
                    + "|xmalloc|xcalloc|xrealloc|zalloc|kalloc\\w*|kmalloc\\w*|kzalloc|kcalloc|kvmalloc\\w*"
                    + "|vmalloc|vzalloc|IOMalloc\\w*|OSMalloc\\w*|g_malloc\\w*|g_new\\w*)\\s*\\(");

    static final Pattern NEW_ARRAY = Pattern.compile("\\bnew\\s+[\\w:<>]+\\s*\\[([^\\]]*)\\]");

    static final Pattern COPY_CALL = Pattern.compile(
            "\\b(?:memcpy|memmove|bcopy|strcpy|strncpy|strlcpy|strcat|strncat|strlcat"
                    + "|copyin|copyout|copyinstr|copy_from_user|copy_to_user)\\s*\\(");

    static final Pattern MULTIPLICATION = Pattern.compile("[\\w)\\]]\\s*\\*\\s*[\\w(]");

    static final Pattern SIZE_PRODUCT_ASSIGN = Pattern.compile(
            "\\b\\w*(?:size|len|length|bytes|total)\\w*\\s*=(?!=)[^;]*?[\\w)\\]]\\s*\\*\\s*[\\w(]",
            Pattern.CASE_INSENSITIVE);

    static final Pattern IF_COMPARISON = Pattern.compile(
            "^\\s*(?:\\}\\s*)?(?:else\\s+)?if\\s*\\(.*[<>]");

    static final Pattern ASSERT_COMPARISON = Pattern.compile(
            "\\b(?:assert|static_assert|_Static_assert|BUG_ON|WARN_ON\\w*|VERIFY\\w*|CHECK\\w*|require\\w*"
                    + "|precondition)\\s*\\(.*[<>]");

    static final Pattern OVERFLOW_HELPER = Pattern.compile(
            "\\b(?:__builtin_\\w+_overflow|os_\\w+_overflow|ckd_(?:add|sub|mul)|check_\\w+_overflow"
                    + "|bounds_check\\w*|range_check\\w*|overflow_check\\w*)\\b");

    static final Pattern FIELD_READ_CALL = Pattern.compile(
            "\\b(?:ntohl|ntohs|ntohll|be16toh|be32toh|be64toh|le16toh|le32toh|le64toh|OSSwap\\w*|OSRead\\w*"
                    + "|get_unaligned\\w*|read_u?int\\w*|read_u\\d+\\w*|read_[bl]e\\d+\\w*)\\s*\\(");

    static final Pattern PARSE_CALL = Pattern.compile(
            "\\b\\w*(?:parse|deserializ|unserializ|decode|unpack)\\w*\\s*\\(",
            Pattern.CASE_INSENSITIVE);

    static final Pattern SCAN_CALL = Pattern.compile(
            "\\b(?:sscanf|fscanf|scanf|strtoul|strtoull|strtol|strtoll|atoi|atol)\\s*\\(");

    static final Pattern LENGTH_FIELD_FROM_INPUT = Pattern.compile(
            "\\b\\w*(?:len|length|count|cnt|size|num)\\w*\\s*=(?!=)[^;]*"
                    + "\\b(?:buf|buffer|input|data|packet|pkt|msg|message|hdr|header|payload|bytes)\\w*",
            Pattern.CASE_INSENSITIVE);

    static final Pattern PRIVILEGE_CALL = Pattern.compile(
            "\\b(?:\\w*[Ee]ntitlement\\w*|\\w*[Pp]rivilege\\w*|sandbox_check\\w*|kauth_\\w+|suser|proc_suser"
                    + "|priv_check\\w*|capable|ns_capable|has_capability\\w*|geteuid|getuid|issetugid"
                    + "|csr_check|mac_\\w+_check\\w*|audit_token_to_\\w+)\\s*\\(");

    private SourcePatterns() {
    }

    static boolean isCommentOrBlank(String line) {
        final String t = line.trim();
        // "* text" continues a block comment; "*p = ..." is code
        return t.isEmpty() || t.startsWith("//") || t.startsWith("/*") || t.startsWith("*/")
                || t.equals("*") || t.startsWith("* ");
    }

    /**
     * Allocation call whose size argument multiplies two terms, or a size-like variable
     * assigned a product.
     */
    static boolean isAllocationSizing(String line) {
        final Matcher call = ALLOC_CALL.matcher(line);
        while (call.find()) {
            final String args = callArguments(line, call.end() - 1);
            if (MULTIPLICATION.matcher(args).find()) {
                return true;
            }
        }
        final Matcher arr = NEW_ARRAY.matcher(line);
        while (arr.find()) {
            if (MULTIPLICATION.matcher(arr.group(1)).find()) {
                return true;
            }
        }
        return SIZE_PRODUCT_ASSIGN.matcher(line).find();
    }

    static boolean isGuard(String line) {
        final String plain = line.replace("->", ".");
        return IF_COMPARISON.matcher(plain).find()
                || ASSERT_COMPARISON.matcher(plain).find()
                || OVERFLOW_HELPER.matcher(plain).find();
    }

    static boolean isAllocationOrCopy(String line) {
        return ALLOC_CALL.matcher(line).find()
                || COPY_CALL.matcher(line).find()
                || NEW_ARRAY.matcher(line).find();
    }

    static boolean isParsingLogic(String line) {
        return FIELD_READ_CALL.matcher(line).find()
                || PARSE_CALL.matcher(line).find()
                || SCAN_CALL.matcher(line).find()
                || LENGTH_FIELD_FROM_INPUT.matcher(line).find();
    }

    static boolean isPrivilegeCheck(String line) {
        return PRIVILEGE_CALL.matcher(line).find();
    }

    /**
     * Text between the parenthesis at openIndex and its matching close, or to end of line
     * when the call continues on the next line.
     */
    static String callArguments(String line, int openIndex) {
        int depth = 0;
        for (int i = openIndex; i < line.length(); i++) {
            final char c = line.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return line.substring(openIndex + 1, i);
                }
            }
        }
        return line.substring(Math.min(openIndex + 1, line.length()));
    }
}
