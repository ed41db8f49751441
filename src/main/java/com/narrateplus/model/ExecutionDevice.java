package com.narrateplus.model;

public enum ExecutionDevice
{
    AUTO,
    CPU,
    GPU
}
