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

/**
 * Edge payload keeping the branch length
 * @author PhyloTree contributors
 */
public class DefaultEdgeData implements NewickPayload {
	
	public static final NewickPayloadFactory<DefaultEdgeData> FACTORY = DefaultEdgeData::new;
	
	private double branchLength = Double.NaN;
	
	public DefaultEdgeData() {
		
	}
	
	public DefaultEdgeData(double branchLength) {
		this.branchLength = branchLength;
	}
	
	public DefaultEdgeData(NewickBrokerElement element) {
		this.branchLength = element.getBranchLength();
	}

	@Override
	public void toNewickElement(NewickBrokerElement element) {
		element.setBranchLength(branchLength);
	}

	/**
	 * @return double Length of the branch or NaN if the length is unknown
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

	@Override
	public String toString() {
		return String.valueOf(branchLength);
	}
}
