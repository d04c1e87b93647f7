package com.acme.specguard.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/** Writes the fully resolved form of a named schema, i.e. what the validators actually enforce. */
@Service
public class ResolvedSchemaExporter {
  private static final Logger log = LoggerFactory.getLogger(ResolvedSchemaExporter.class);

  private final ObjectMapper om;
  private final SchemaLoader loader;
  private final RefResolver resolver;
  private final Path defaultDir;

  public ResolvedSchemaExporter(ObjectMapper om, SchemaLoader loader, RefResolver resolver,
                                @Value("${specguard.schemas.export-dir:./out/resolved-schemas}") String defaultDir) {
    this.om = om; this.loader = loader; this.resolver = resolver;
    this.defaultDir = Paths.get(defaultDir);
  }

  public Path export(String name) { return export(name, defaultDir); }

  /** Exports to {@code outDir/<name>.resolved.schema.json}. */
  public Path export(String name, Path outDir) {
    var loaded = loader.load(name);
    JsonNode resolved = resolver.resolve(loaded.root(), loaded.baseUri(), ReferenceStore.empty(), null);
    try {
      Files.createDirectories(outDir);
      Path out = outDir.resolve(name + ".resolved.schema.json");
      om.writerWithDefaultPrettyPrinter().writeValue(out.toFile(), resolved);
      log.info("Resolved schema {} written to {}", name, out);
      return out;
    } catch (IOException e) {
      throw new UncheckedIOException("Export failed for schema: " + name, e);
    }
  }
}
