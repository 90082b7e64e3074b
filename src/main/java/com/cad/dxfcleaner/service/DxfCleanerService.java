package com.cad.dxfcleaner.service;

import com.cad.dxfcleaner.exception.DxfReadException;
import com.cad.dxfcleaner.model.CleanDiagnostics;
import com.cad.dxfcleaner.model.ParseResult;
import com.cad.dxfcleaner.parser.DxfParser;
import com.cad.dxfcleaner.rebuild.DxfRebuilder;
import com.cad.dxfcleaner.rebuild.RebuildResult;
import com.cad.dxfcleaner.template.BuiltInTemplates;
import com.cad.dxfcleaner.template.DxfTemplates;
import com.cad.dxfcleaner.template.FileTemplateLoader;
import com.cad.dxfcleaner.template.TemplateLoader;
import com.cad.dxfcleaner.template.TemplateRenderer;
import com.cad.dxfcleaner.util.FileWriteUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Runs one cleaning pass: load templates, parse the source drawing, rebuild
 * it and write the result.
 */
public class DxfCleanerService {
    private static final Logger log = LoggerFactory.getLogger(DxfCleanerService.class);

    private final CleanerConfig config;
    private final TemplateLoader templateLoader;
    private final TemplateRenderer renderer;
    private final DxfFileReader fileReader;
    private final OutputPathResolver outputPathResolver;

    public DxfCleanerService(CleanerConfig config) {
        this(config, new FileTemplateLoader(config.getTemplateDir()));
    }

    public DxfCleanerService(CleanerConfig config, TemplateLoader templateLoader) {
        this.config = config;
        this.templateLoader = templateLoader;
        this.renderer = new TemplateRenderer();
        this.fileReader = new DxfFileReader();
        this.outputPathResolver = new OutputPathResolver();
    }

    public CleanResult clean() {
        CleanDiagnostics diagnostics = new CleanDiagnostics();
        Path input = config.getInputFile();
        log.info("Processing: {}", input);

        // Step 1: Templates
        DxfTemplates templates = loadTemplates(diagnostics);

        // Step 2: Parse
        List<String> lines;
        try {
            lines = fileReader.readLines(input);
        } catch (DxfReadException e) {
            log.error(e.getMessage());
            return CleanResult.failure(e.getMessage());
        }
        ParseResult parsed = new DxfParser(config.getEntityWhitelist()).parse(lines, diagnostics);

        // Step 3: Rebuild
        RebuildResult rebuilt = new DxfRebuilder(renderer, config.getEntityHandleStart())
                .rebuild(parsed, templates, diagnostics);

        // Step 4: Write
        Path outputPath = outputPathResolver.resolve(input, config.getOutputDir(), config.getOutputSuffix());
        if (config.isDryRun()) {
            log.info("Dry run: skipping write of {}", outputPath);
        } else {
            try {
                FileWriteUtil.safeWriteString(outputPath, rebuilt.getContent());
                log.info("Cleaned DXF saved to: {}", outputPath);
            } catch (IOException e) {
                String message = "Error saving file " + outputPath + ": " + e.getMessage();
                log.error(message, e);
                return CleanResult.failure(message);
            }
        }

        return CleanResult.builder()
                .success(true)
                .outputPath(outputPath)
                .content(rebuilt.getContent())
                .layersParsed(parsed.getLayerCount())
                .entitiesParsed(parsed.getEntityCount())
                .handlesSynthesized(rebuilt.getHandlesSynthesized())
                .headerLayout(rebuilt.getHeaderLayout())
                .builtInHeader(templates.isBuiltInHeader())
                .builtInFooter(templates.isBuiltInFooter())
                .warnings(diagnostics.getWarnings())
                .infos(diagnostics.getInfos())
                .build();
    }

    DxfTemplates loadTemplates(CleanDiagnostics diagnostics) {
        BuiltInTemplates builtIns = new BuiltInTemplates(renderer);
        DxfTemplates.DxfTemplatesBuilder templates = DxfTemplates.builder();

        Optional<String> header = templateLoader.loadHeader();
        if (header.isPresent()) {
            templates.header(header.get());
        } else {
            warnTemplateMissing("Header", diagnostics);
            templates.header(builtIns.minimalHeader()).builtInHeader(true);
        }

        Optional<String> footer = templateLoader.loadFooter();
        if (footer.isPresent()) {
            templates.footer(footer.get());
        } else {
            warnTemplateMissing("Footer", diagnostics);
            templates.footer(builtIns.minimalFooter()).builtInFooter(true);
        }

        return templates.build();
    }

    private void warnTemplateMissing(String label, CleanDiagnostics diagnostics) {
        String message = label + " template unavailable, using minimal " + label.toLowerCase() + " instead";
        log.warn(message);
        diagnostics.warn(message);
    }
}
