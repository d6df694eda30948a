package com.parsely.backend.services.extraction.layout;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Offline-trained multinomial logistic regression over {@link LayoutFeatureExtractor} features.
 * {@code weights[c][f]} is the weight of feature {@code f} for class {@code c}. Optional
 * {@code featureMeans}/{@code featureScales} standardize the raw feature values first.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class LayoutModel {

    private String version;
    private List<String> featureNames;
    private List<String> classes;
    private double[][] weights;
    private double[] bias;
    private double[] featureMeans;
    private double[] featureScales;
    private double minConfidence = 0.5;
}
