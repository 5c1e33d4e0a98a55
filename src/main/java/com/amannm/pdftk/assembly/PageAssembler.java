package com.amannm.pdftk.assembly;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amannm.pdftk.document.DocumentRegistry;
import com.amannm.pdftk.document.PageOutOfRangeException;
import com.amannm.pdftk.range.NoDefaultDocumentException;
import com.amannm.pdftk.range.PageResolver;
import com.amannm.pdftk.range.PageSpec;

/**
 * Builds the ordered output sequence for one operation from parsed ranges.
 */
public class PageAssembler {

    private static final Logger log = LoggerFactory.getLogger(PageAssembler.class);

    private final DocumentRegistry registry;

    public PageAssembler(DocumentRegistry registry) {
        this.registry = registry;
    }

    public List<OutputPage> assemble(AssemblyMode mode, List<PageSpec> specs) {
        List<OutputPage> sequence = switch (mode) {
            case CAT -> cat(specs);
            case ROTATE -> rotate(specs);
            case SHUFFLE -> shuffle(specs);
        };
        log.debug("{} produced {} pages: {}", mode, sequence.size(), sequence);
        return sequence;
    }

    /**
     * Flattens the ranges in the order given. Without ranges, every page of every document
     * is taken, documents in ascending handle order.
     */
    public List<OutputPage> cat(List<PageSpec> specs) {
        List<OutputPage> sequence = new ArrayList<>();
        if (specs.isEmpty()) {
            for (String handle : registry.handles()) {
                for (int page : PageResolver.allPages(registry.pageCount(handle))) {
                    sequence.add(new OutputPage(handle, page, 0));
                }
            }
            return sequence;
        }
        for (PageSpec spec : specs) {
            String handle = handleOf(spec);
            for (int page : spec.pages()) {
                sequence.add(new OutputPage(handle, page, spec.rotation()));
            }
        }
        return sequence;
    }

    /**
     * Keeps every page of the default document in place and applies the rotation the ranges give it.
     * When ranges overlap the later one wins.
     *
     * @throws PageOutOfRangeException when a range names a page the document does not have
     */
    public List<OutputPage> rotate(List<PageSpec> specs) {
        String handle = registry.defaultHandle()
            .orElseThrow(() -> new NoDefaultDocumentException(registry.size()));
        int pageCount = registry.pageCount(handle);

        Map<Integer, Integer> rotations = new HashMap<>();
        for (PageSpec spec : specs) {
            for (int page : spec.pages()) {
                if (page < 1 || page > pageCount) {
                    throw new PageOutOfRangeException(handle, page, pageCount);
                }
                rotations.put(page, spec.rotation());
            }
        }

        List<OutputPage> sequence = new ArrayList<>(pageCount);
        for (int page = 1; page <= pageCount; page++) {
            sequence.add(new OutputPage(handle, page, rotations.getOrDefault(page, 0)));
        }
        return sequence;
    }

    /**
     * Interleaves the ranges one page at a time. A range that runs out drops out of the rotation
     * and the remaining ones carry on without gaps.
     */
    public List<OutputPage> shuffle(List<PageSpec> specs) {
        List<Deque<OutputPage>> live = new ArrayList<>(specs.size());
        for (int i = 0; i < specs.size(); i++) {
            PageSpec spec = specs.get(i);
            if (!spec.hasHandle()) {
                throw new ShuffleRequiresHandlesException(i + 1);
            }
            Deque<OutputPage> queue = new ArrayDeque<>(spec.pages().size());
            for (int page : spec.pages()) {
                queue.addLast(new OutputPage(spec.handle(), page, spec.rotation()));
            }
            live.add(queue);
        }

        List<OutputPage> sequence = new ArrayList<>();
        while (!live.isEmpty()) {
            List<Deque<OutputPage>> stillLive = new ArrayList<>(live.size());
            for (Deque<OutputPage> queue : live) {
                OutputPage next = queue.pollFirst();
                if (next == null) {
                    continue;
                }
                sequence.add(next);
                stillLive.add(queue);
            }
            live = stillLive;
        }
        return sequence;
    }

    private String handleOf(PageSpec spec) {
        if (spec.hasHandle()) {
            return spec.handle();
        }
        return registry.defaultHandle()
            .orElseThrow(() -> new NoDefaultDocumentException(registry.size()));
    }
}
