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
package phylotree.tree.io;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Node of a Newick tree stored in a flat list. The depth is the number of edges to the root
 * @author PhyloTree contributors
 */
public class NewickBrokerElement {
	private String name = "";
	private double branchLength = Double.NaN;
	private int depth = 0;
	private final List<String> comments = new ArrayList<>();
	private final List<String> tags = new ArrayList<>();
	// Position in the source text. Zero if the element was not parsed
	private int line = 0;
	private int column = 0;
	
	public NewickBrokerElement() {
		
	}
	
	public NewickBrokerElement(int depth) {
		this.depth = depth;
	}
	
	/**
	 * @return Name of the element. Empty string if the element has no name
	 */
	public String getName() {
		return name;
	}
	
	public void setName(String name) {
		if(name==null) name = "";
		this.name = name;
	}
	
	/**
	 * @return Branch length to the parent or NaN if the element does not have a branch length
	 */
	public double getBranchLength() {
		return branchLength;
	}
	
	public void setBranchLength(double branchLength) {
		this.branchLength = branchLength;
	}
	
	public boolean hasBranchLength() {
		return !Double.isNaN(branchLength);
	}
	
	public int getDepth() {
		return depth;
	}
	
	public void setDepth(int depth) {
		if(depth<0) throw new IllegalArgumentException("Depth can not be negative. Value: "+depth);
		this.depth = depth;
	}
	
	public List<String> getComments() {
		return Collections.unmodifiableList(comments);
	}
	
	public void addComment(String comment) {
		comments.add(comment);
	}
	
	public List<String> getTags() {
		return Collections.unmodifiableList(tags);
	}
	
	public void addTag(String tag) {
		tags.add(tag);
	}
	
	public int getLine() {
		return line;
	}
	
	public int getColumn() {
		return column;
	}
	
	public void setPosition(int line, int column) {
		this.line = line;
		this.column = column;
	}

	@Override
	public String toString() {
		StringBuilder answer = new StringBuilder();
		answer.append("depth: ").append(depth).append(" name: '").append(name).append("'");
		if(hasBranchLength()) answer.append(" length: ").append(branchLength);
		if(!comments.isEmpty()) answer.append(" comments: ").append(comments);
		if(!tags.isEmpty()) answer.append(" tags: ").append(tags);
		return answer.toString();
	}
}
