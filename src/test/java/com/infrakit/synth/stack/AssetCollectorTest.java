package com.infrakit.synth.stack;

import com.infrakit.synth.model.Asset;
import com.infrakit.synth.resource.lambda.Architecture;
import com.infrakit.synth.resource.lambda.Code;
import com.infrakit.synth.resource.lambda.FunctionBuilder;
import com.infrakit.synth.resource.lambda.FunctionResources;
import com.infrakit.synth.resource.lambda.Runtime;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class AssetCollectorTest {

    private final AssetCollector collector = new AssetCollector();

    private static FunctionResources function(String id, Code code) {
        return FunctionBuilder.create(id, Architecture.ARM64, 256, 10)
                .code(code)
                .handler("bootstrap")
                .runtime(Runtime.PROVIDED_AL2023)
                .build();
    }

    @Test
    void testTwoFunctionsSharingAnArchiveYieldOneAsset() throws Exception {
        FunctionResources first = function("first", Code.zip("assets", Path.of("build/app.zip")));
        FunctionResources second = function("second", Code.zip("assets", Path.of("build/../build/app.zip")));

        Template template = new StackBuilder().register(first).register(second).build();

        List<Asset> assets = collector.collect(template);
        assertThat(assets).hasSize(1);
        assertThat(assets.get(0).getLocalPath()).isEqualTo(Path.of("build/app.zip").toAbsolutePath().normalize());
        assertThat(template.getAssets()).isEqualTo(assets);
    }

    @Test
    void testDistinctArchivesYieldDistinctAssets() {
        FunctionResources first = function("first", Code.zip("assets", Path.of("build/one.zip")));
        FunctionResources second = function("second", Code.zip("assets", Path.of("build/two.zip")));

        List<Asset> assets = collector.collect(List.of(first.getFunction(), second.getFunction()));

        assertThat(assets).hasSize(2);
        assertThat(assets.get(0).getKey()).isNotEqualTo(assets.get(1).getKey());
    }

    @Test
    void testInlineCodeHasNoAsset() {
        FunctionResources inline = function("inline", Code.inline("print('hi')"));

        assertThat(collector.collect(inline.getResources())).isEmpty();
    }
}
