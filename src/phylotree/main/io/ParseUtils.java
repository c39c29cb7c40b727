/*******************************************************************************
 * PhyloTree - Phylogenetic trees and Newick processing
 * Copyright 2026 PhyloTree contributors
 *
 * This file is part of PhyloTree.
 *
 *     PhyloTree is free software: you can redistribute it and/or modify
 *     it under the terms of the GNU General Public License as published by
 *     the Free Software Foundation, either version 3 of the License, or
 *     (at your option) any later version.
 *
 *     PhyloTree is distributed in the hope that it will be useful,
 *     but WITHOUT ANY WARRANTY; without even the implied warranty of
 *     MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *     GNU General Public License for more details.
 *
 *     You should have received a copy of the GNU General Public License
 *     along with PhyloTree.  If not, see <http://www.gnu.org/licenses/>.
 *******************************************************************************/
package phylotree.main.io;

import java.math.BigDecimal;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;

public class ParseUtils {
	public static final DecimalFormatSymbols ENGLISH_SYMBOLS = DecimalFormatSymbols.getInstance(Locale.ENGLISH);
	/**
	 * Precision value meaning that numbers are printed with all the digits needed to read them back unchanged
	 */
	public static final int EXACT_PRECISION = -1;
	
	/**
	 * Creates a format for decimal numbers that prints at most the given number of decimal places,
	 * dropping trailing zeros. Decimal separator is always a dot.
	 * @param precision Maximum number of decimal places
	 * @return DecimalFormat Format for the given precision
	 */
	public static DecimalFormat createDecimalFormat(int precision) {
		if(precision<0) throw new IllegalArgumentException("Precision can not be negative. Value: "+precision);
		StringBuilder pattern = new StringBuilder("0");
		if(precision>0) pattern.append('.');
		for(int i=0;i<precision;i++) pattern.append('#');
		DecimalFormat format = new DecimalFormat(pattern.toString(), ENGLISH_SYMBOLS);
		format.setGroupingUsed(false);
		return format;
	}
	
	/**
	 * Formats the given number in plain decimal notation with the shortest sequence of digits
	 * that parses back to the same double. Trailing zeros are dropped.
	 * @param value Number to format. It must be finite
	 * @return String plain decimal representation of the value
	 */
	public static String formatExact(double value) {
		if(Double.isNaN(value) || Double.isInfinite(value)) throw new IllegalArgumentException("Can not format non finite number "+value);
		if(value==0) return "0";
		return new BigDecimal(Double.toString(value)).stripTrailingZeros().toPlainString();
	}
	
	/**
	 * Tells if the given text is a number in the format [+-]123[.456][eE[+-]789]
	 * @param s The text to check
	 * @return boolean true if the whole text is a number
	 */
	public static boolean isNumber(CharSequence s) {
		if(s.length()==0) return false;
		int start = 0;
		if(Lexer.isSign(s.charAt(0))) start = 1;
		if(start>=s.length() || !Lexer.isDigit(s.charAt(start))) return false;
		return Lexer.findNumberEnd(s, 0) == s.length();
	}
	
	/**
	 * Parses a number in the format accepted by {@link #isNumber(CharSequence)}
	 * @param s The text to parse
	 * @return double the parsed value
	 * @throws NumberFormatException If the text is not a valid number 
	 */
	public static double parseDouble(String s) {
		if(!isNumber(s)) throw new NumberFormatException("Invalid number: "+s);
		return Double.parseDouble(s);
	}
}
