package com.cad.dxfcleaner.rebuild;

import com.cad.dxfcleaner.model.CleanDiagnostics;
import com.cad.dxfcleaner.model.ParseResult;
import com.cad.dxfcleaner.template.DxfTemplates;
import com.cad.dxfcleaner.template.TemplateRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Composes the normalized drawing from a {@link ParseResult}.
 *
 * Phases run in a fixed order: header splice, LAYER table, fixed skeleton,
 * entities, footer. No phase fails on odd input; an unspliceable header
 * degrades with a warning. Layer handles are decided before synthesized
 * entity handles and both avoid every handle already present in the output.
 * The parse result is never modified.
 */
public class DxfRebuilder {
    private static final Logger log = LoggerFactory.getLogger(DxfRebuilder.class);

    private final StructuralSkeleton skeleton;
    private final HeaderSplicer headerSplicer;
    private final LayerTableWriter layerTableWriter;
    private final EntitySectionWriter entitySectionWriter;
    private final int entityHandleStart;

    public DxfRebuilder(TemplateRenderer renderer, int entityHandleStart) {
        this.skeleton = new StructuralSkeleton(renderer);
        this.headerSplicer = new HeaderSplicer(skeleton);
        this.layerTableWriter = new LayerTableWriter();
        this.entitySectionWriter = new EntitySectionWriter();
        this.entityHandleStart = entityHandleStart;
    }

    public RebuildResult rebuild(ParseResult parsed, DxfTemplates templates, CleanDiagnostics diagnostics) {
        DxfOutputBuilder out = new DxfOutputBuilder();
        HandleRegistry registry = HandleRegistry.withCapturedHandles(parsed.getEntities());
        EntityHandleAllocator handles = new EntityHandleAllocator(entityHandleStart, registry);

        log.debug("Phase 1: header splice");
        HeaderTemplate.Layout layout = headerSplicer.splice(
                templates.getHeader(), parsed.getLayerCount(), out, diagnostics);

        log.debug("Phase 2: LAYER table");
        int layers = layerTableWriter.write(parsed.getLayers(), registry, out, diagnostics);

        log.debug("Phase 3: fixed tables and blocks");
        out.raw(skeleton.tablesAndBlocks());

        log.debug("Phase 4: entities");
        int entities = entitySectionWriter.write(parsed.getEntities(), handles, out);

        log.debug("Phase 5: footer");
        out.line("0");
        out.raw(templates.getFooter());

        log.debug("Rebuilt {} layers and {} entities ({} handles synthesized, {} chars)",
                layers, entities, handles.getAllocated(), out.length());

        return RebuildResult.builder()
                .content(out.toString())
                .headerLayout(layout)
                .layersWritten(layers)
                .entitiesWritten(entities)
                .handlesSynthesized(handles.getAllocated())
                .build();
    }
}
