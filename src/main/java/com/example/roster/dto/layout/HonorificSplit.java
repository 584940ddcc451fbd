package com.example.roster.dto.layout;

import lombok.Value;

@Value
public class HonorificSplit {
    String honorific;
    String person;
}
