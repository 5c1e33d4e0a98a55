package com.amannm.pdftk.range;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.amannm.pdftk.document.DocumentRegistry;
import com.amannm.pdftk.document.PageOutOfRangeException;

/**
 * Parses page range expressions such as {@code "1-5 A10east Bend-1odd"}.
 * <p>
 * Each whitespace separated token reads, left to right, as an optional handle ({@code A}, {@code BC}),
 * a page or page range, an optional {@code even}/{@code odd} qualifier and an optional rotation keyword.
 * A token made of a handle alone selects the whole document. When the page part is left out after
 * a handle or before a qualifier or rotation, every page of the document is used, so {@code Aeven}
 * means the even pages of {@code A}.
 * <p>
 * Page references are checked against the document they point into, so a token naming a page the
 * document does not have fails here with {@link PageOutOfRangeException}.
 */
public class PageRangeParser {

    private static final Pattern HANDLE = Pattern.compile("^[A-Z]+");

    private final DocumentRegistry registry;

    public PageRangeParser(DocumentRegistry registry) {
        this.registry = registry;
    }

    /**
     * Parse a whitespace separated range expression.
     *
     * @param expression the expression, may be blank
     * @return one {@link PageSpec} per token, in token order; empty for a blank expression
     */
    public List<PageSpec> parse(String expression) {
        if (expression == null || expression.isBlank()) {
            return List.of();
        }
        List<PageSpec> specs = new ArrayList<>();
        for (String token : expression.trim().split("\\s+")) {
            specs.add(parseToken(token));
        }
        return specs;
    }

    /**
     * Parse ranges handed over as separate arguments. An argument may itself hold several tokens.
     */
    public List<PageSpec> parse(List<String> ranges) {
        return parse(String.join(" ", ranges));
    }

    PageSpec parseToken(String token) {
        String handle = null;
        String body = token;
        Matcher matcher = HANDLE.matcher(token);
        if (matcher.find()) {
            handle = matcher.group();
            body = token.substring(handle.length());
        }

        if (handle != null && body.isEmpty()) {
            return new PageSpec(handle, PageResolver.allPages(registry.pageCount(documentOf(handle, token))), 0);
        }

        int rotation = 0;
        Optional<RotationKeyword> rotationKeyword = RotationKeyword.suffixOf(body);
        if (rotationKeyword.isPresent()) {
            rotation = rotationKeyword.get().degrees();
            body = stripSuffix(body, rotationKeyword.get().keyword());
        }

        Optional<PageQualifier> qualifier = PageQualifier.suffixOf(body);
        if (qualifier.isPresent()) {
            body = stripSuffix(body, qualifier.get().keyword());
        }

        String document = documentOf(handle, token);
        List<Integer> pages;
        try {
            pages = PageResolver.resolve(body, registry.pageCount(document));
        } catch (InvalidPageTokenException e) {
            throw e.inToken(token);
        } catch (PageOutOfRangeException e) {
            throw e.inDocument(document, token);
        }
        if (qualifier.isPresent()) {
            pages = qualifier.get().apply(pages);
        }
        return new PageSpec(handle, pages, rotation);
    }

    // the handle the token refers to, the default document's when it names none
    private String documentOf(String handle, String token) {
        if (handle != null) {
            if (!registry.contains(handle)) {
                throw new UnknownHandleException(handle);
            }
            return handle;
        }
        return registry.defaultHandle()
            .orElseThrow(() -> new NoDefaultDocumentException(token, registry.size()));
    }

    private static String stripSuffix(String body, String suffix) {
        return body.substring(0, body.length() - suffix.length());
    }
}
