/**
 **
 ** CorrelationParameters.java - Parameters of the two-point correlation runs
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  CorrelationParameters.java is free software: you can redistribute it and/or modify
 **  it under the terms of the GNU General Public License as published by
 **  the Free Software Foundation, either version 3 of the License, or
 **  (at your option) any later version.
 **
 **  This program is distributed in the hope that it will be useful,
 **  but WITHOUT ANY WARRANTY; without even the implied warranty of
 **  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 **  GNU General Public License for more details.
 **
 **  You should have received a copy of the GNU General Public License
 **  along with this program.  If not, see <http://www.gnu.org/licenses/>.
 ** -----------------------------------------------------------------------------**
 **
 */

package com.elphel.twopoint.correlation;

import java.io.IOException;
import java.util.Properties;

import com.elphel.twopoint.common.EProperties;

import ij.gui.GenericDialog;

public class CorrelationParameters {
	public static final String DEFAULTS_RESOURCE = "twopoint.properties";
	public static final String DEFAULTS_PREFIX =   "twopoint.";
	public static final String [] MODES = {"full", "patched"};
	public static final String [] KINDS = {"auto", "cross"};

	public String  mode =                 "patched"; // full/patched
	public String  kind =                 "auto";    // auto/cross
	public int     cutoff =               10;        // maximal lag along each axis, result is 2*cutoff+1 wide
	public int     winmulti =             3;         // nominal window core is winmulti*(cutoff+1)
	public String  default_array =        "H1";      // array identifier when a reference names none
	public String  container_extensions = ".tif,.tiff";
	public boolean log_progress =         true;      // report ETA and percentage of patched runs

	public CorrelationParameters() {
	}

	/** Parameters with the defaults from the classpath resource, built-in values where it is silent. */
	public static CorrelationParameters loadDefaults() throws IOException {
		CorrelationParameters params = new CorrelationParameters();
		params.getProperties(DEFAULTS_PREFIX, EProperties.loadResource(DEFAULTS_RESOURCE));
		return params;
	}

	public CorrelationMode getMode() {
		return CorrelationMode.fromName(mode);
	}

	public CorrelationKind getKind() {
		return CorrelationKind.fromName(kind);
	}

	public String [] getContainerExtensions() {
		String [] items = container_extensions.split(",");
		for (int i = 0; i < items.length; i++) items[i] = items[i].trim();
		return items;
	}

	public void dialogQuestions(GenericDialog gd) {
		gd.addMessage  ("Two-point correlation (vector counts)");
		gd.addChoice      ("Memory mode",                              MODES, this.mode);
		gd.addChoice      ("Correlation type",                         KINDS, this.kind);
		gd.addNumericField("Cutoff (maximal lag)",                     this.cutoff,   0, 4, "pix");
		gd.addNumericField("Window size multiplier",                   this.winmulti, 0, 3, "");
		gd.addMessage  ("Window blocks (core + 2*cutoff) are padded to powers of two for the FFT");
		gd.addMessage     ("Patched mode window core is multiplier*(cutoff+1), larger windows use more memory and take less time.");
		gd.addStringField ("Default array name",                       this.default_array, 10);
		gd.addStringField ("Container extensions",                     this.container_extensions, 20);
		gd.addCheckbox    ("Report progress",                          this.log_progress);
	}

	public void dialogAnswers(GenericDialog gd) {
		this.mode =                        gd.getNextChoice();
		this.kind =                        gd.getNextChoice();
		this.cutoff =                (int) gd.getNextNumber();
		this.winmulti =              (int) gd.getNextNumber();
		this.default_array =               gd.getNextString();
		this.container_extensions =        gd.getNextString();
		this.log_progress =                gd.getNextBoolean();
	}

	public void setProperties(String prefix,Properties properties){
		properties.setProperty(prefix+"mode",                     this.mode);                          // String
		properties.setProperty(prefix+"kind",                     this.kind);                          // String
		properties.setProperty(prefix+"cutoff",                   this.cutoff+"");                     // int
		properties.setProperty(prefix+"winmulti",                 this.winmulti+"");                   // int
		properties.setProperty(prefix+"default_array",            this.default_array);                 // String
		properties.setProperty(prefix+"container_extensions",     this.container_extensions);          // String
		properties.setProperty(prefix+"log_progress",             this.log_progress+"");               // boolean
	}

	public void getProperties(String prefix,Properties properties){
		if (properties.getProperty(prefix+"mode")!=null)                 this.mode=properties.getProperty(prefix+"mode");
		if (properties.getProperty(prefix+"kind")!=null)                 this.kind=properties.getProperty(prefix+"kind");
		if (properties.getProperty(prefix+"cutoff")!=null)               this.cutoff=Integer.parseInt(properties.getProperty(prefix+"cutoff").trim());
		if (properties.getProperty(prefix+"winmulti")!=null)             this.winmulti=Integer.parseInt(properties.getProperty(prefix+"winmulti").trim());
		if (properties.getProperty(prefix+"default_array")!=null)        this.default_array=properties.getProperty(prefix+"default_array");
		if (properties.getProperty(prefix+"container_extensions")!=null) this.container_extensions=properties.getProperty(prefix+"container_extensions");
		if (properties.getProperty(prefix+"log_progress")!=null)         this.log_progress=Boolean.parseBoolean(properties.getProperty(prefix+"log_progress").trim());
	}

	@Override
	public CorrelationParameters clone() throws CloneNotSupportedException {
		CorrelationParameters cp =     new CorrelationParameters();
		cp.mode =                      this.mode;
		cp.kind =                      this.kind;
		cp.cutoff =                    this.cutoff;
		cp.winmulti =                  this.winmulti;
		cp.default_array =             this.default_array;
		cp.container_extensions =      this.container_extensions;
		cp.log_progress =              this.log_progress;
		return cp;
	}
}
