package com.aiinpocket.combat.exception;

/** 場次、地點、敵人、素材或物品類型不存在（或場次已過期） */
public class NotFoundException extends CombatException {

    public NotFoundException(String resource, Object id) {
        super(resource + " 不存在: " + id);
    }

    public NotFoundException(String message) {
        super(message);
    }

    @Override
    public String getCode() {
        return "NOT_FOUND";
    }
}
