package com.github.micycle1.ppfac.model;

public enum InterpolationMethod {
	KRIGING, IDW
}
