package com.vfxport.external;

import java.nio.file.Path;
import java.util.Collection;

/**
 * Copies files referenced by ported blocks from the donor project to the target project.
 * Implementations report problems in the returned report instead of throwing.
 */
public interface AssetCopier {

    AssetCopyReport copy(Path donorFile, Path targetFile, Collection<String> assetPaths);
}
