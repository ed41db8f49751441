package com.narrateplus.resource;

public enum DeviceClass
{
    WEAK,
    MEDIUM,
    STRONG
}
