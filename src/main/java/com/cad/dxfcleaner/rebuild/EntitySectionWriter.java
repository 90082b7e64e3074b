package com.cad.dxfcleaner.rebuild;

import com.cad.dxfcleaner.model.DxfEntity;
import com.cad.dxfcleaner.model.GroupCodePair;

import java.util.List;

/**
 * Writes the captured entities in their original order. An entity without
 * a handle gets one from the allocator as its first property.
 */
public class EntitySectionWriter {

    public int write(List<DxfEntity> entities, EntityHandleAllocator handles, DxfOutputBuilder out) {
        for (DxfEntity entity : entities) {
            DxfEntity emitted = entity.hasHandle() ? entity : entity.withLeadingHandle(handles.next());
            out.pair("0", emitted.getKind());
            for (GroupCodePair property : emitted.getProperties()) {
                out.pair(property);
            }
        }
        return entities.size();
    }
}
