package com.cornerdetect.API;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
public class HarrisRequest {
    private double[][] image;
    private String boundaryMode;
    private Double fillValue;
}
