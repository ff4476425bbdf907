package com.elphel.mvs.common;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

public class EProperties extends Properties{
	private static final long serialVersionUID = -425120416815883046L;

	public static EProperties loadFrom(InputStream is) throws IOException {
		EProperties properties = new EProperties();
		properties.load(is);
		return properties;
	}

	public int getProperty(String key, int value){
		return Integer.parseInt(getProperty(key, ""+value).trim());
	}
	public double getProperty(String key, double value){
		return Double.parseDouble(getProperty(key, ""+value).trim());
	}
	public boolean getProperty(String key, boolean value){
		return Boolean.parseBoolean(getProperty(key, ""+value).trim());
	}
	/**
	 * Comma-separated list of numbers, e.g. a matrix row
	 * @param key property name
	 * @param value returned when the property is missing
	 * @return parsed values
	 */
	public double [] getProperty(String key, double [] value){
		String s = getProperty(key);
		if (s == null) {
			return value;
		}
		String [] tokens = s.split(",");
		double [] d = new double [tokens.length];
		for (int i = 0; i < d.length; i++) {
			d[i] = Double.parseDouble(tokens[i].trim());
		}
		return d;
	}
}
