package com.aiinpocket.combat.model.domain;

/** 結算時發放的一筆素材堆疊（同素材同風格已合併） */
public record MaterialReward(
        String materialId,
        String name,
        String styleId,
        int quantity
) {

    public String grantKey() {
        return "material:" + materialId + ":" + styleId;
    }

    public MaterialReward plus(int more) {
        return new MaterialReward(materialId, name, styleId, quantity + more);
    }
}
