package com.portfoliorisk.backend.service.port;

import com.portfoliorisk.backend.model.AssetInfo;

import java.util.List;
import java.util.Map;

public interface AssetMetadataSource {

    /** Partial or empty maps are valid responses. */
    Map<String, AssetInfo> getAssetsForSymbolList(List<String> symbols);
}
