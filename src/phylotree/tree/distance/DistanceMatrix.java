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
package phylotree.tree.distance;

import java.io.BufferedReader;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.text.DecimalFormat;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import phylotree.main.io.ParseUtils;

/**
 * Symmetric matrix of distances between named objects
 * @author PhyloTree contributors
 */
public class DistanceMatrix {
	
	public static final int MATRIX_TYPE_FULL = 0;
	public static final int MATRIX_TYPE_LOWER = 1;
	public static final int MATRIX_TYPE_UPPER = 2;
	public static final int DEF_PRECISION = 6;

	private final List<String> ids;
	private final double [][] distances;
	private int matrixOutputType = MATRIX_TYPE_FULL;
	private int precision = DEF_PRECISION;
	
	/**
	 * Creates a matrix with copies of the given ids and distances
	 * @param ids of the objects in the order of the rows
	 * @param distances Square matrix of distances between the objects
	 */
	public DistanceMatrix(List<String> ids, double [][] distances) {
		if(ids.size()!=distances.length) throw new IllegalArgumentException("Number of ids "+ids.size()+" does not match the number of rows "+distances.length);
		for(int i=0;i<distances.length;i++) {
			if(distances[i].length!=distances.length) throw new IllegalArgumentException("Row "+i+" has "+distances[i].length+" columns. Expected: "+distances.length);
		}
		this.ids = new ArrayList<>(ids);
		this.distances = new double[distances.length][];
		for(int i=0;i<distances.length;i++) this.distances[i] = distances[i].clone();
	}
	
	/**
	 * Loads a matrix from a text file. The first line has the number of objects. Each following line
	 * has the id of one object and its distances, as a full, lower triangular or upper triangular matrix
	 * @param filename Path to the file
	 * @return DistanceMatrix loaded matrix
	 * @throws IOException If the file can not be read or has invalid numbers
	 */
	public static DistanceMatrix load(String filename) throws IOException {
		List<String> ids = new ArrayList<>();
		try (BufferedReader in = new BufferedReader(new InputStreamReader(new FileInputStream(filename), StandardCharsets.UTF_8))) {
			String line = in.readLine();
			if(line==null) throw new IOException("Empty distance matrix file: "+filename);
			int n;
			try {
				n = Integer.parseInt(line.trim());
			} catch (NumberFormatException e) {
				throw new IOException("Number format error reading number of objects: "+line,e);
			}
			double [][] distances = new double[n][n];
			int type = -1;
			line = in.readLine();
			int row = 0;
			while (line!=null) {
				if(line.trim().isEmpty()) {
					line = in.readLine();
					continue;
				}
				if(row>=n) throw new IOException("More than "+n+" rows in distance matrix file: "+filename);
				String [] items = line.trim().split("\\s+");
				ids.add(items[0]);
				int values = items.length-1;
				if(type==-1) {
					// The first row of a lower matrix has no values and the first row of an upper matrix has n-1
					if(values==n) type = MATRIX_TYPE_FULL;
					else if (values==0) type = MATRIX_TYPE_LOWER;
					else type = MATRIX_TYPE_UPPER;
				}
				int firstColumn = (type==MATRIX_TYPE_UPPER)?row+1:0;
				int expected = (type==MATRIX_TYPE_FULL)?n:((type==MATRIX_TYPE_LOWER)?row:n-row-1);
				if(values!=expected) throw new IOException("Row "+(row+1)+" has "+values+" values. Expected: "+expected);
				for(int j=0;j<values;j++) {
					double value;
					try {
						value = ParseUtils.parseDouble(items[j+1]);
					} catch (NumberFormatException e) {
						throw new IOException("Number format error at row "+(row+1)+" column: "+(j+1)+" value: "+items[j+1],e);
					}
					int column = firstColumn+j;
					distances[row][column] = value;
					if(type!=MATRIX_TYPE_FULL) distances[column][row] = value;
				}
				row++;
				line = in.readLine();
			}
			if(row!=n) throw new IOException("Expected "+n+" rows in distance matrix file: "+filename+" but found "+row);
			return new DistanceMatrix(ids, distances);
		}
	}
	
	/**
	 * Print distance matrix.
	 * Matrix types:
	 *  0 = full matrix
	 *  1 = Lower-left matrix
	 *  2 = Upper-right matrix
	 * @param out Stream to print the matrix
	 */
	public void printMatrix(PrintStream out) {
		DecimalFormat format = ParseUtils.createDecimalFormat(precision);
		out.println(getNumObjects());
		for(int i=0;i<distances.length;i++) {
			StringBuilder row = new StringBuilder(ids.get(i));
			for(int j=0;j<distances[i].length;j++) {
				boolean print = matrixOutputType == MATRIX_TYPE_FULL || (matrixOutputType == MATRIX_TYPE_LOWER && i>j) || (matrixOutputType == MATRIX_TYPE_UPPER && j>i);
				if(print) row.append(' ').append(format.format(distances[i][j]));
			}
			out.println(row);
		}
	}
	
	public List<String> getIds() {
		return Collections.unmodifiableList(ids);
	}
	
	public int getNumObjects() {
		return distances.length;
	}
	
	public double getDistance(int i, int j) {
		return distances[i][j];
	}
	
	/**
	 * @param id1 First id
	 * @param id2 Second id
	 * @return double Distance between the objects with the given ids
	 */
	public double getDistance(String id1, String id2) {
		int i = ids.indexOf(id1);
		int j = ids.indexOf(id2);
		if(i<0) throw new IllegalArgumentException("Unknown id: "+id1);
		if(j<0) throw new IllegalArgumentException("Unknown id: "+id2);
		return distances[i][j];
	}

	public int getMatrixOutputType() {
		return matrixOutputType;
	}

	public void setMatrixOutputType(int matrixOutputType) {
		if(matrixOutputType<MATRIX_TYPE_FULL || matrixOutputType>MATRIX_TYPE_UPPER) throw new IllegalArgumentException("Invalid matrix type: "+matrixOutputType);
		this.matrixOutputType = matrixOutputType;
	}

	public int getPrecision() {
		return precision;
	}

	public void setPrecision(int precision) {
		if(precision<0) throw new IllegalArgumentException("Precision can not be negative. Value: "+precision);
		this.precision = precision;
	}
}
