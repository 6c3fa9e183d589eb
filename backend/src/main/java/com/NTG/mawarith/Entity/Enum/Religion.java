package com.NTG.mawarith.Entity.Enum;

public enum Religion {
    ISLAM,
    CHRISTIANITY,
    JEWISH,
    OTHER
}
