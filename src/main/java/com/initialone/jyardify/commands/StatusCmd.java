package com.initialone.jyardify.commands;

import com.initialone.jyardify.manifest.ProcessingManifest;
import com.initialone.jyardify.model.ManifestEntry;
import com.initialone.jyardify.pipeline.OutputLayout;
import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@CommandLine.Command(
        name = "status",
        description = "Show what the manifest records as documented and as failed."
)
public class StatusCmd implements Callable<Integer> {

    @CommandLine.Option(names = "--output", defaultValue = "output/latest",
            description = "Output directory holding manifest.json (default: ${DEFAULT-VALUE})")
    String output;

    @Override
    public Integer call() {
        OutputLayout layout = new OutputLayout(Paths.get(output), null, OutputLayout.Structure.FLAT);
        if (!Files.exists(layout.manifestFile())) {
            System.out.println("[status] no manifest at " + layout.manifestFile());
            return 0;
        }
        ProcessingManifest manifest = ProcessingManifest.load(layout.manifestFile(), null, true, layout::documentedFile);
        Map<String, ManifestEntry> processed = manifest.processedFiles();
        List<String> failed = manifest.failedFiles();

        System.out.println("[status] manifest: " + manifest.file());
        System.out.println("[status] processed = " + processed.size() + ", failed = " + failed.size());
        for (String f : failed) {
            System.out.println("  - " + f);
        }
        return 0;
    }
}
