package com.narrateplus.model;

public enum Quantization
{
    FP32,
    FP16,
    Q8,
    Q4,
    Q4F16
}
