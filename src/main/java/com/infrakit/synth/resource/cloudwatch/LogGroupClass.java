package com.infrakit.synth.resource.cloudwatch;

public enum LogGroupClass {
    STANDARD,
    INFREQUENT_ACCESS
}
