package com.flamingo.pagination.service.footnote;

import com.flamingo.pagination.domain.block.FlowBlock;
import com.flamingo.pagination.domain.layout.Fragment;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Footnote references in the body and the blocks rendering each footnote's body.
 *
 * <p>Every footnote body block id must start with {@link Fragment#FOOTNOTE_ID_PREFIX} so its
 * fragments land in the footnote band when rendered.
 *
 * @param refs reference marks, in any order
 * @param blocksById footnote id to the blocks of its body
 */
public record FootnoteLinkage(List<FootnoteRef> refs, Map<String, List<FlowBlock>> blocksById) {

  public static final FootnoteLinkage NONE = new FootnoteLinkage(List.of(), Map.of());

  public FootnoteLinkage {
    refs = refs == null ? List.of() : List.copyOf(refs);
    Map<String, List<FlowBlock>> copy = new LinkedHashMap<>();
    if (blocksById != null) {
      for (Map.Entry<String, List<FlowBlock>> entry : blocksById.entrySet()) {
        List<FlowBlock> blocks = List.copyOf(entry.getValue());
        for (FlowBlock block : blocks) {
          if (!Fragment.isFootnoteId(block.id())) {
            throw new IllegalArgumentException(
                "Footnote " + entry.getKey() + " body block id must start with '"
                    + Fragment.FOOTNOTE_ID_PREFIX + "': " + block.id());
          }
        }
        copy.put(entry.getKey(), blocks);
      }
    }
    blocksById = Collections.unmodifiableMap(copy);
  }

  public boolean isEmpty() {
    return refs.isEmpty();
  }

  public List<FlowBlock> bodyOf(String footnoteId) {
    return blocksById.getOrDefault(footnoteId, List.of());
  }
}
